package com.pipeline.etl.quality;

import com.pipeline.etl.MutableClock;
import com.pipeline.etl.core.QualityMonitor;
import com.pipeline.etl.exception.DataQualityException;
import com.pipeline.etl.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QualityValidatorTest {

    @Mock
    private QualityMonitor monitor;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
    private Dataset orders;

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @BeforeEach
    void setUp() {
        orders = Dataset.fromRows(List.of(
                row("order_no", "A-1", "amount", 120.0, "email", "x@shop.io"),
                row("order_no", "A-2", "amount", -5.0, "email", null),
                row("order_no", "A-3", "amount", 40.0, "email", "y@shop.io")));
    }

    private List<QualityRule> rules() {
        return List.of(
                new NotNullRule("email_present", "email", RuleSeverity.ERROR),
                new RangeRule("amount_positive", "amount", 0.0, null, RuleSeverity.WARNING),
                new UniqueRule("order_unique", "order_no", RuleSeverity.ERROR));
    }

    @Test
    void testTransform_strictModeRaisesWithFailedRuleNames() {
        QualityValidator validator = new QualityValidator("validator", rules(), true,
                monitor, "orders", "orders_table", clock);

        DataQualityException e = assertThrows(DataQualityException.class, () -> validator.transform(orders));

        assertEquals(List.of("email_present"), e.getFailedRules());
        // 严格模式下指标仍先记录
        verify(monitor).recordRuleResults(eq("orders"), eq("orders_table"), anyList());
        verify(monitor).recordDataProfile(eq("orders"), eq("orders_table"), any(DataProfile.class));
    }

    @Test
    void testTransform_nonStrictModeReturnsInputAndKeepsWarnings() throws Exception {
        QualityValidator validator = new QualityValidator("validator", rules(), false,
                monitor, "orders", null, clock);

        Dataset output = validator.transform(orders);

        assertSame(orders, output);
        List<String> warnings = validator.drainWarnings();
        assertEquals(2, warnings.size());
        assertTrue(validator.drainWarnings().isEmpty(), "Warnings are drained once");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RuleResult>> captor = ArgumentCaptor.forClass(List.class);
        verify(monitor).recordRuleResults(eq("orders"), eq("orders"), captor.capture());
        assertEquals(3, captor.getValue().size());

        ValidationResult last = validator.getLastResult();
        assertFalse(last.isPassed());
        assertEquals(1, last.getPassedRules());
        assertEquals(2, last.getFailedRules());
        assertEquals(3, last.getDataProfile().getTotalRows());
        assertEquals(clock.instant(), last.getDataProfile().getTimestamp());
    }

    @Test
    void testTransform_warningOnlyFailuresNeverRaise() throws Exception {
        QualityValidator validator = new QualityValidator("validator",
                List.of(new RangeRule("amount_positive", "amount", 0.0, null, RuleSeverity.WARNING)), true);

        assertSame(orders, validator.transform(orders));
        assertTrue(validator.getLastResult().isPassed());
        assertEquals(1, validator.drainWarnings().size());
    }

    @Test
    void testTransform_missingColumnRecordedWithoutHalting() {
        Dataset idsOnly = Dataset.fromRows(List.of(row("id", 1), row("id", 2)));
        QualityValidator validator = new QualityValidator("validator",
                List.of(new NotNullRule("email_present", "email", RuleSeverity.WARNING)), false,
                monitor, "members", "members", clock);

        Dataset output = validator.transform(idsOnly);

        assertSame(idsOnly, output);
        ValidationResult result = validator.getLastResult();
        assertFalse(result.isPassed());
        assertEquals(1, result.getRuleResults().size());
        assertTrue(result.getRuleResults().get(0).getMessage().startsWith("Rule execution failed: "));
        assertEquals(1, result.getDataProfile().getColumns().size(), "Profiling runs regardless of rule outcomes");
        verify(monitor).recordRuleResults(eq("members"), eq("members"), anyList());
        verify(monitor).recordDataProfile(eq("members"), eq("members"), any(DataProfile.class));
        assertFalse(validator.drainWarnings().isEmpty());
    }

    @Test
    void testTransform_missingColumnBlocksInStrictMode() {
        Dataset idsOnly = Dataset.fromRows(List.of(row("id", 1)));
        QualityValidator validator = new QualityValidator("validator",
                List.of(new NotNullRule("email_present", "email", RuleSeverity.WARNING)), true,
                monitor, "members", "members", clock);

        DataQualityException e = assertThrows(DataQualityException.class, () -> validator.transform(idsOnly));
        assertEquals(List.of("email_present"), e.getFailedRules());
    }

    @Test
    void testValidate_doesNotTouchMonitor() {
        QualityValidator validator = new QualityValidator("validator", rules(), true,
                monitor, "orders", "orders", clock);

        ValidationResult result = validator.validate(orders);

        assertEquals(3, result.getTotalRules());
        assertEquals(List.of("Column 'email' has 1 null values"), result.getErrors());
        verifyNoInteractions(monitor);
    }
}
