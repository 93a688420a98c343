package com.alibou.deliverychat.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Aspect
@Configuration
public class ServiceLoggingAspect {

    private static final int MAX_STRING = 80;

    /** Все публичные методы бинов @Service */
    @Around("within(@org.springframework.stereotype.Service *)")
    public Object logAround(ProceedingJoinPoint pjp) throws Throwable {
        String method = pjp.getSignature().getDeclaringType().getSimpleName() + "." + pjp.getSignature().getName();
        long start = System.nanoTime();
        log.debug("ВХОД  {}({})", method, argList(pjp.getArgs()));

        try {
            Object result = pjp.proceed();
            log.debug("ВЫХОД {} → {} ({} мс)", method, shorten(result), (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (Throwable ex) {
            log.warn("ОШИБКА {} после {} мс – {}", method, (System.nanoTime() - start) / 1_000_000, ex.toString());
            throw ex;
        }
    }

    static String argList(Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        return Arrays.stream(args)
                .map(ServiceLoggingAspect::shorten)
                .collect(Collectors.joining(", "));
    }

    /** Краткая запись: тексты сообщений и сокеты целиком в лог не попадают. */
    static String shorten(Object o) {
        if (o == null) return "null";

        if (o instanceof Number || o instanceof Boolean || o instanceof Enum<?>)
            return o.toString();

        if (o instanceof CharSequence cs) {
            String s = cs.toString();
            return s.length() <= MAX_STRING
                    ? "\"" + s + "\""
                    : "\"" + s.substring(0, MAX_STRING - 3) + "…\"(" + s.length() + " chars)";
        }

        if (o instanceof Record) {
            return o.toString();
        }

        if (o.getClass().isArray()) {
            return o.getClass().getComponentType().getSimpleName() + "[" + Array.getLength(o) + "]";
        }

        if (o instanceof Collection<?> c) {
            return c.getClass().getSimpleName() + "(size=" + c.size() + ")";
        }

        if (o instanceof Map<?, ?> m) {
            return m.getClass().getSimpleName() + "(size=" + m.size() + ")";
        }

        // entities and connections: Type[id=…]
        try {
            Method idGetter = o.getClass().getMethod("getId");
            return o.getClass().getSimpleName() + "[id=" + idGetter.invoke(o) + "]";
        } catch (ReflectiveOperationException | RuntimeException ex) {
            return o.getClass().getSimpleName();
        }
    }
}
