package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.CallableResolutionException;
import com.ryuqq.scheduler.core.executor.CallableResolver;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.CallableRef;

import java.util.List;

/**
 * 여러 Resolver를 순서대로 시도하는 Resolver.
 *
 * <p>처음으로 해석에 성공한 결과를 반환하고, 모두 실패하면 각 실패 사유를
 * suppressed로 담은 {@link CallableResolutionException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompositeCallableResolver implements CallableResolver {

    private final List<CallableResolver> resolvers;

    public CompositeCallableResolver(List<CallableResolver> resolvers) {
        if (resolvers == null || resolvers.isEmpty()) {
            throw new IllegalArgumentException("resolvers cannot be null or empty");
        }
        this.resolvers = List.copyOf(resolvers);
    }

    @Override
    public TaskFunction resolve(CallableRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        CallableResolutionException failure = new CallableResolutionException(
            "Cannot resolve callable " + ref.getValue()
        );
        for (CallableResolver resolver : resolvers) {
            try {
                return resolver.resolve(ref);
            } catch (CallableResolutionException e) {
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }
}
