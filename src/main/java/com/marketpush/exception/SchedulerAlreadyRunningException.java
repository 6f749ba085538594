package com.marketpush.exception;

public class SchedulerAlreadyRunningException extends BaseException {

    public SchedulerAlreadyRunningException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
