package com.nayem.tether.spring;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as a singular call.
 * <p>
 * At most one invocation of the method runs across the whole cluster within the lock
 * window. The lock is named {@code context:methodName}. A call that finds the lock held
 * does not run: it returns {@code false} from a {@code boolean}/{@code Boolean} method, the
 * zero value from any other primitive method and {@code null} from everything else.
 * </p>
 *
 * <h3>Usage Example</h3>
 *
 * <pre>{@code
 * @Service
 * public class ReportService {
 *
 *     @Singular(context = "reports", ttlSeconds = 30)
 *     public boolean rebuildDailyReport() {
 *         // runs on one node at a time
 *         return true;
 *     }
 * }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Singular {

    /**
     * Lock namespace. Empty uses {@code tether.lock.context}.
     */
    String context() default "";

    /**
     * Lock window in seconds. 0 or less uses {@code tether.lock.ttl}.
     */
    long ttlSeconds() default 0;
}
