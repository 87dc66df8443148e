package com.williamcallahan.pftreport.logging;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.pipeline.StageProcessor;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

/**
 * Logs each stage invocation of the processing pipeline on the dedicated PIPELINE logger.
 *
 * <p>Stage processors return cold {@link Mono}s, so timing is attached to the subscription rather than
 * to the method call itself.</p>
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    /**
     * Log stage execution
     */
    @Around("execution(reactor.core.publisher.Mono com.williamcallahan.pftreport.service.pipeline.StageProcessor+.process(..))")
    public Object logStageExecution(ProceedingJoinPoint joinPoint) throws Throwable {
        StageProcessor processor = (StageProcessor) joinPoint.getTarget();
        ProcessingStage stage = processor.stage();
        String requestId = requestIdOf(joinPoint.getArgs());

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable assemblyFailure) {
            PIPELINE_LOG.error("[{}] STAGE {} - Failed before start: {}", requestId, stage, assemblyFailure.getMessage());
            throw assemblyFailure;
        }
        if (!(result instanceof Mono<?> stageMono)) {
            return result;
        }

        AtomicLong startedAt = new AtomicLong();
        return stageMono
                .doOnSubscribe(subscription -> {
                    startedAt.set(System.nanoTime());
                    PIPELINE_LOG.info("[{}] STAGE {} - Starting ({})", requestId, stage, stage.label());
                })
                .doOnNext(outcome -> {
                    long durationMs = elapsedMillis(startedAt);
                    if (outcome instanceof StageOutcome.Failure failure) {
                        PIPELINE_LOG.warn("[{}] STAGE {} - Reported failure after {}ms: {}",
                                requestId, stage, durationMs, failure.reason());
                    } else {
                        PIPELINE_LOG.info("[{}] STAGE {} - Completed in {}ms", requestId, stage, durationMs);
                    }
                })
                .doOnError(error -> PIPELINE_LOG.error("[{}] STAGE {} - Failed after {}ms: {}",
                        requestId, stage, elapsedMillis(startedAt), error.getMessage()))
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL) {
                        PIPELINE_LOG.warn("[{}] STAGE {} - Abandoned after {}ms",
                                requestId, stage, elapsedMillis(startedAt));
                    }
                });
    }

    /**
     * Log report hand-off once the artifact is stored
     */
    @AfterReturning(
            pointcut = "execution(* com.williamcallahan.pftreport.service.pipeline.ArtifactStore+.store(..))",
            returning = "resultRef")
    public void logReportStored(Object resultRef) {
        PIPELINE_LOG.info("============================================");
        PIPELINE_LOG.info("REPORT STORED - {}", resultRef);
        PIPELINE_LOG.info("============================================");
    }

    private static String requestIdOf(Object[] args) {
        if (args.length > 0 && args[0] instanceof PipelineContext context) {
            return context.requestId();
        }
        return "unknown";
    }

    private static long elapsedMillis(AtomicLong startedAt) {
        long start = startedAt.get();
        return start == 0 ? 0 : (System.nanoTime() - start) / 1_000_000;
    }
}
