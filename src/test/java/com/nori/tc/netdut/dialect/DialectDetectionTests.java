package com.nori.tc.netdut.dialect;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 콘솔 출력 기반 dialect 추정 테스트
 */
class DialectDetectionTests {

    @Test
    void mos_banner_before_login_prompt() {
        String banner = "\nMetamako MOS 0.30.0 bernie ttyS0\n\nbernie login: ";

        assertEquals(Optional.of(Dialect.MOS), DialectDetection.fromLoginBanner(banner));
    }

    @Test
    void plain_login_prompt_is_eos() {
        assertEquals(Optional.of(Dialect.EOS), DialectDetection.fromLoginBanner("\nlocalhost login: "));
        assertEquals(Optional.of(Dialect.EOS), DialectDetection.fromLoginBanner("Last login: Mon\nswitch login:"));
    }

    @Test
    void no_login_prompt_gives_empty() {
        assertEquals(Optional.empty(), DialectDetection.fromLoginBanner("Welcome\nswitch>"));
        assertEquals(Optional.empty(), DialectDetection.fromLoginBanner("Last login: Mon Oct 12\n"));
    }

    @Test
    void hardware_version_field_means_eos() {
        String eos = "Arista DCS-7130-48L-R\nHardware version: 11.02\nSerial number: JPE123\n";
        String mos = "Device: Metamako MetaConnect 48\nSKU: DCS-7130-48L-R\nSerial number: C48-A3\n";

        assertEquals(Dialect.EOS, DialectDetection.fromShowVersion(eos));
        assertEquals(Dialect.MOS, DialectDetection.fromShowVersion(mos));
    }
}
