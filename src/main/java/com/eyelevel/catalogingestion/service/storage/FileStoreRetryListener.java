package com.eyelevel.catalogingestion.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("fileStoreRetryListener")
@Slf4j
public class FileStoreRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (context.getRetryCount() > 0) {
            String key = "UnknownKey";
            Object[] args = (Object[]) context.getAttribute("context.args");

            if (args != null && args.length > 0 && args[0] instanceof String) {
                key = (String) args[0];
            }

            log.warn("File store write for key '{}' failed on attempt {}. Retrying...", key, context.getRetryCount(),
                     throwable);
        }
    }
}
