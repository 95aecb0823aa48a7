package com.gt.practice.model;

public enum TaskState {
    Presented,
    Answered
}
