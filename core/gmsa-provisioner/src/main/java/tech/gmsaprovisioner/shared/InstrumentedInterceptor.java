package tech.gmsaprovisioner.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.security.secrets.SecretResolutionException;

import java.time.Duration;

@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);

    static final String METRIC = "gmsa.dependency.call";
    private static final Duration SLOW_CALL = Duration.ofSeconds(5);

    @Inject
    MeterRegistry registry;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String dependency = dependencyOf(ctx);
        String operation = ctx.getMethod().getName();
        String outcome = "ok";
        long start = System.nanoTime();
        try {
            return ctx.proceed();
        } catch (Exception e) {
            outcome = outcomeOf(e);
            throw e;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            Timer.builder(METRIC)
                .tag("dependency", dependency)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
            if (elapsed.compareTo(SLOW_CALL) > 0) {
                LOG.warnf("%s.%s took %dms (%s)", dependency, operation, elapsed.toMillis(), outcome);
            }
        }
    }

    static String outcomeOf(Exception e) {
        if (e instanceof ProvisioningException pe) {
            return pe.kind().wireName();
        }
        if (e instanceof SecretResolutionException) {
            return "secret_unresolved";
        }
        return "unexpected";
    }

    private static String dependencyOf(InvocationContext ctx) {
        Instrumented onMethod = ctx.getMethod().getAnnotation(Instrumented.class);
        if (onMethod != null && !onMethod.target().isEmpty()) {
            return onMethod.target();
        }
        // Client proxies subclass the bean, @Inherited carries the class annotation
        Instrumented onType = ctx.getTarget().getClass().getAnnotation(Instrumented.class);
        if (onType != null && !onType.target().isEmpty()) {
            return onType.target();
        }
        return ctx.getMethod().getDeclaringClass().getSimpleName();
    }
}
