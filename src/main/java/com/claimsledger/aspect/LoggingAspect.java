package com.claimsledger.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Call logging for the service, controller and repository layers.
 *
 * Service calls: entry with parameters, outcome, duration (INFO).
 * Controller calls: one line in, one line out (INFO).
 * Repository calls: DEBUG only.
 *
 * Guard rejections (InvalidOperation / InvalidTransition / bad input) are
 * expected outcomes and logged at WARN; anything else at ERROR.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final int MAX_VALUE_LENGTH = 120;

    private final long slowServiceMs;
    private final long slowQueryMs;

    public LoggingAspect(
            @Value("${claimsledger.logging.slow-service-ms:1000}") long slowServiceMs,
            @Value("${claimsledger.logging.slow-query-ms:500}") long slowQueryMs) {
        this.slowServiceMs = slowServiceMs;
        this.slowQueryMs = slowQueryMs;
    }

    @Around("execution(public * com.claimsledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        String previousCallId = MDC.get("callId");
        String callId = Long.toString(System.nanoTime(), 36);
        MDC.put("callId", callId);

        log.info("╔══ SERVICE CALL: {} [{}]", call, callId);
        Object[] args = joinPoint.getArgs();
        String[] names = signature.getParameterNames();
        for (int i = 0; args != null && i < args.length; i++) {
            String name = (names != null && i < names.length) ? names[i] : "arg" + i;
            log.info("║   {} = {}", name, formatParameter(name, args[i]));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("╚══ ✓ {} -> {} ({} ms)", call, formatParameter("result", result),
                    System.currentTimeMillis() - startTime);
            return result;

        } catch (IllegalArgumentException | IllegalStateException | java.util.NoSuchElementException e) {
            log.warn("╚══ ✗ {} rejected after {} ms - {}: {}", call, System.currentTimeMillis() - startTime,
                    e.getClass().getSimpleName(), e.getMessage());
            throw e;

        } catch (Exception e) {
            log.error("╚══ ✗ {} failed after {} ms - {}: {}", call, System.currentTimeMillis() - startTime,
                    e.getClass().getSimpleName(), e.getMessage());
            throw e;

        } finally {
            long executionTime = System.currentTimeMillis() - startTime;
            if (executionTime > slowServiceMs) {
                log.warn("⚠ SLOW OPERATION: {} took {} ms", call, executionTime);
            }
            if (previousCallId != null) {
                MDC.put("callId", previousCallId);
            } else {
                MDC.remove("callId");
            }
        }
    }

    @Around("execution(public * com.claimsledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        log.info("→ HTTP REQUEST: {}", call);
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("← HTTP RESPONSE: {} completed in {} ms", call, System.currentTimeMillis() - startTime);
            return result;

        } catch (Exception e) {
            log.info("← HTTP ERROR: {} after {} ms - {}: {}",
                    call, System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.claimsledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        if (log.isDebugEnabled()) {
            Object[] args = joinPoint.getArgs();
            String params = args == null ? "" : Arrays.stream(args)
                    .map(arg -> formatParameter("arg", arg))
                    .collect(Collectors.joining(", "));
            log.debug("DB CALL: {}({})", call, params);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.debug("DB RETURN: {} in {} ms", call, executionTime);
            if (executionTime > slowQueryMs) {
                log.warn("⚠ SLOW QUERY: {} took {} ms", call, executionTime);
            }
            return result;

        } catch (Exception e) {
            log.debug("DB ERROR: {} - {}: {}", call, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Render a value for a log line: collections as their size, secrets
     * redacted, long values truncated.
     */
    static String formatParameter(String name, Object value) {
        if (value == null) {
            return "null";
        }
        String lowerName = name.toLowerCase(Locale.ROOT);
        if (lowerName.contains("token") || lowerName.contains("secret") || lowerName.contains("password")) {
            return "[REDACTED]";
        }
        if (value instanceof Collection<?>) {
            return value.getClass().getSimpleName() + "[size=" + ((Collection<?>) value).size() + "]";
        }
        String text = value.toString();
        if (text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, MAX_VALUE_LENGTH - 3) + "...";
        }
        return text;
    }
}
