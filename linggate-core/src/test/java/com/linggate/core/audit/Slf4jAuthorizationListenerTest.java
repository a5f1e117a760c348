package com.linggate.core.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.linggate.api.context.CallContext;
import com.linggate.api.security.AuthenticationVerifier;
import com.linggate.api.security.AuthorizationOutcome;
import com.linggate.core.rule.AccessRule;
import com.linggate.core.rule.RuleList;
import com.linggate.core.security.RuleMatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Slf4jAuthorizationListener 日志测试")
class Slf4jAuthorizationListenerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jAuthorizationListener.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final CallContext context = CallContext.of("myapp.Greeter", "sayHello", "token-1");

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
    }

    private List<ILoggingEvent> events(Level level) {
        return appender.list.stream().filter(e -> e.getLevel() == level).toList();
    }

    @Test
    @DisplayName("判定抛异常时恰好输出一条 ERROR，并附带异常")
    void throwingPredicateLogsOneError() {
        RuleMatcher matcher = new RuleMatcher(AuthenticationVerifier.tokenPresent(), new Slf4jAuthorizationListener());
        RuleList rules = RuleList.of(
                AccessRule.predicate((ctx, token) -> {
                    throw new IllegalStateException("lookup failed");
                }),
                AccessRule.role("admin"));

        boolean matched = matcher.anyMatch(rules, Set.of(), context).toCompletableFuture().join();

        assertFalse(matched);
        List<ILoggingEvent> errors = events(Level.ERROR);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getFormattedMessage().contains("myapp.Greeter.sayHello"));
        assertEquals("lookup failed", errors.get(0).getThrowableProxy().getMessage());
    }

    @Test
    @DisplayName("拒绝输出 WARN，放行输出 DEBUG")
    void decisionsAreLoggedByOutcome() {
        Slf4jAuthorizationListener listener = new Slf4jAuthorizationListener();

        listener.onDecision(context, AuthorizationOutcome.UNAUTHENTICATED);
        listener.onDecision(context, AuthorizationOutcome.ALLOWED);

        List<ILoggingEvent> warnings = events(Level.WARN);
        assertEquals(1, warnings.size());
        assertEquals("DENY: [myapp.Greeter.sayHello] Unauthenticated (code=16)", warnings.get(0).getFormattedMessage());
        assertEquals(1, events(Level.DEBUG).size());
    }
}
