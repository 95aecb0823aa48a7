package com.gt.practice.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.practice.content.ContentItemDao;
import com.gt.practice.content.impl.ContentItemDaoPG;
import com.gt.practice.schedule.SchedulingRecordDao;
import com.gt.practice.schedule.impl.SchedulingRecordDaoPG;
import com.gt.practice.session.PracticeSessionDao;
import com.gt.practice.session.impl.PracticeSessionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${practice.datasource.postgres.url}") String url,
                                    @Value("${practice.datasource.postgres.username}") String username,
                                    @Value("${practice.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ContentItemDao getContentItemDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new ContentItemDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public SchedulingRecordDao getSchedulingRecordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new SchedulingRecordDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public PracticeSessionDao getPracticeSessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new PracticeSessionDaoPG(namedParameterJdbcTemplate, objectMapper);
    }
}
