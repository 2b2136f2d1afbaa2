package org.example.coursearchiver.retry;

import java.io.IOException;

@FunctionalInterface
public interface RetryableAction<T> {
    T run() throws IOException, InterruptedException;
}
