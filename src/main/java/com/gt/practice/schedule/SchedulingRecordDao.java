package com.gt.practice.schedule;

import com.gt.practice.model.SchedulingRecord;

import java.util.Collection;
import java.util.List;

public interface SchedulingRecordDao {

    List<SchedulingRecord> loadRecords(String learnerId, Collection<String> itemIds);

    List<SchedulingRecord> loadAllRecords(String learnerId);

    // Insert or replace. Safe to repeat with the same record.
    void saveRecord(String learnerId, SchedulingRecord record);
}
