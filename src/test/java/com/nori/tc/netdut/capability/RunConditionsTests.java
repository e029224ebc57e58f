package com.nori.tc.netdut.capability;

import com.nori.tc.netdut.dialect.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 테스트 실행 조건 테스트
 *
 * - skipDeviceType: 매칭되면 skip
 * - onlyDeviceType: 매칭되지 않으면 skip
 * - onlyDialects: 허용 dialect가 아니면 skip
 * - 여러 조건은 AND, 첫 skip 사유를 돌려준다
 */
class RunConditionsTests {

    private static final DeviceIdentity EOS_7130 = new DeviceIdentity("DCS-7130-48L-R", Dialect.EOS);
    private static final DeviceIdentity MOS_7130 = new DeviceIdentity("DCS-7130-48L-R", Dialect.MOS);
    private static final DeviceIdentity EOS_7150 = new DeviceIdentity("DCS-7150S-24-R", Dialect.EOS);

    @Test
    void skip_device_type_skips_matching_sku() {
        RunCondition c = RunConditions.skipDeviceType("DCS-7130.*", "no phy loopback");

        RunDecision d = c.evaluate(EOS_7130);
        assertTrue(d.shouldSkip());
        assertEquals("Skipped on this SKU: DCS-7130-48L-R: no phy loopback", d.reason());

        assertSame(RunDecision.run(), c.evaluate(EOS_7150));
    }

    @Test
    void only_device_type_skips_other_skus() {
        RunCondition c = RunConditions.onlyDeviceType("DCS-7130.*");

        assertFalse(c.evaluate(EOS_7130).shouldSkip());
        assertEquals("Skipped on this SKU: DCS-7150S-24-R (only runs on DCS-7130.*)", c.evaluate(EOS_7150).reason());
    }

    @Test
    void only_dialects_is_or_over_dialects() {
        RunCondition mosOnly = RunConditions.onlyDialects(Dialect.MOS);
        assertFalse(mosOnly.evaluate(MOS_7130).shouldSkip());
        assertEquals("cannot run on platform eos", mosOnly.evaluate(EOS_7130).reason());

        RunCondition both = RunConditions.onlyDialects(Dialect.EOS, Dialect.MOS);
        assertFalse(both.evaluate(EOS_7130).shouldSkip());
        assertFalse(both.evaluate(MOS_7130).shouldSkip());
    }

    @Test
    void only_dialects_requires_at_least_one() {
        assertThrows(IllegalArgumentException.class, () -> RunConditions.onlyDialects(List.of()));
    }

    @Test
    void stacked_conditions_are_anded_and_report_first_skip() {
        RunCondition c = RunConditions.onlyDialects(Dialect.EOS)
                .and(RunConditions.skipDeviceType("DCS-7150.*"));

        assertFalse(c.evaluate(EOS_7130).shouldSkip());
        assertEquals("cannot run on platform mos", c.evaluate(MOS_7130).reason());
        assertEquals("Skipped on this SKU: DCS-7150S-24-R", c.evaluate(EOS_7150).reason());
    }

    @Test
    void invalid_pattern_fails_when_condition_is_built() {
        assertThrows(CapabilityPatternException.class, () -> RunConditions.skipDeviceType("DCS-[7130"));
    }
}
