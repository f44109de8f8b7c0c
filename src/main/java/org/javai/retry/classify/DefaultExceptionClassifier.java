package org.javai.retry.classify;

import java.util.List;
import java.util.Set;

/**
 * Default classification of operation failures.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>Unrecoverable host conditions ({@link VirtualMachineError}: out of memory, stack
 *       overflow, internal VM errors) are never retried.</li>
 *   <li>If retryable types are configured and the failure is an instance of none of them,
 *       it is not retried.</li>
 *   <li>Anything else is retried.</li>
 * </ol>
 */
public final class DefaultExceptionClassifier implements ExceptionClassifier {

    static final DefaultExceptionClassifier INSTANCE = new DefaultExceptionClassifier();

    private static final List<Class<? extends Throwable>> UNRECOVERABLE = List.of(
            OutOfMemoryError.class,
            StackOverflowError.class,
            InternalError.class,
            UnknownError.class
    );

    @Override
    public boolean isRetryable(Throwable error, Set<Class<? extends Throwable>> retryOn) {
        if (isUnrecoverable(error)) {
            return false;
        }

        if (!retryOn.isEmpty() && retryOn.stream().allMatch(type -> !type.isInstance(error))) {
            return false;
        }

        return true;
    }

    /**
     * Whether the failure signals a condition the process cannot recover from.
     */
    public static boolean isUnrecoverable(Throwable error) {
        return UNRECOVERABLE.stream().anyMatch(type -> type.isInstance(error));
    }
}
