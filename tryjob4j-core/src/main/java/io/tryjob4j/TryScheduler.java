package io.tryjob4j;

import java.util.List;

/**
 * Master-side ingress that turns delivered jobs into buildsets.
 *
 * <p>Lifecycle: {@code inactive -> active -> inactive}. Both transitions are idempotent.
 */
public interface TryScheduler extends JobIngress {

    String name();

    List<String> builderNames();

    void start();

    void stop();

    boolean isActive();
}
