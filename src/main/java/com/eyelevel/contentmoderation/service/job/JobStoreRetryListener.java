package com.eyelevel.contentmoderation.service.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("jobStoreRetryListener")
@Slf4j
public class JobStoreRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("Job store write failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }
}
