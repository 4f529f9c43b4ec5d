package tech.webextools.sdk.http;

import java.time.Duration;

/**
 * Blocks the calling thread during retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
