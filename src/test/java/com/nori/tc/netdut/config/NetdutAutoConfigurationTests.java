package com.nori.tc.netdut.config;

import com.nori.tc.netdut.capability.DeviceIdentity;
import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.poll.Poller;
import com.nori.tc.netdut.session.DeviceSession;
import com.nori.tc.netdut.translate.RuleTable;
import com.nori.tc.netdut.translate.Translator;
import com.nori.tc.netdut.translate.Translators;
import com.nori.tc.netdut.translate.UnknownDialectException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * tc.netdut 자동 구성 테스트
 *
 * - 기본: Translators.standard(), 30초/100ms Poller, dialect는 접속 시 판별
 * - 사용자 Translator Bean이 있으면 그것을 사용
 * - 지원하지 않는 dialect는 기동 실패
 */
class NetdutAutoConfigurationTests {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(NetdutAutoConfiguration.class));

    @Test
    void registers_default_beans() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(Translator.class);
            assertThat(context).hasSingleBean(Poller.class);
            assertThat(context).hasSingleBean(DutConnector.class);

            assertThat(context.getBean(Translator.class)).isSameAs(Translators.standard());
            assertThat(context.getBean(Poller.class).getDefaultTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(context.getBean(Poller.class).getDefaultInterval()).isEqualTo(Duration.ofMillis(100));
            assertThat(context.getBean(DutConnector.class).configuredDialect()).isEmpty();
            assertThat(context.getBean(NetdutProperties.class).getConsole().getUsername()).isEqualTo("admin");
        });
    }

    @Test
    void binds_properties() {
        runner.withPropertyValues(
                        "tc.netdut.dialect=MOS",
                        "tc.netdut.defaults.wait-timeout-sec=5",
                        "tc.netdut.defaults.poll-interval-ms=20",
                        "tc.netdut.console.url=telnet://bernie:1001",
                        "tc.netdut.console.username=ops",
                        "tc.netdut.console.password=secret")
                .run(context -> {
                    Poller poller = context.getBean(Poller.class);
                    assertThat(poller.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(poller.getDefaultInterval()).isEqualTo(Duration.ofMillis(20));

                    DutConnector connector = context.getBean(DutConnector.class);
                    assertThat(connector.configuredDialect()).contains(Dialect.MOS);
                    assertThat(context.getBean(NetdutProperties.class).getConsole().getUsername()).isEqualTo("ops");
                    assertThat(context.getBean(NetdutProperties.class).getConsole().getPassword()).isEqualTo("secret");
                    assertThat(connector.resolveEapiHost()).isEqualTo("bernie");
                });
    }

    @Test
    void explicit_eapi_host_wins_over_console_host() {
        runner.withPropertyValues(
                        "tc.netdut.console.url=telnet://bernie:1001",
                        "tc.netdut.eapi.host=10.0.0.7")
                .run(context -> assertThat(context.getBean(DutConnector.class).resolveEapiHost()).isEqualTo("10.0.0.7"));
    }

    @Test
    void user_translator_replaces_default() {
        runner.withUserConfiguration(CustomTranslatorConfig.class)
                .withPropertyValues("tc.netdut.dialect=sonic")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(Translator.class).supports(Dialect.of("sonic"))).isTrue();
                    assertThat(context.getBean(DutConnector.class).configuredDialect()).contains(Dialect.of("sonic"));
                });
    }

    @Test
    void unsupported_dialect_fails_startup() {
        runner.withPropertyValues("tc.netdut.dialect=sonic")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(UnknownDialectException.class);
                });
    }

    @Test
    void configured_sku_skips_device_query() {
        runner.withPropertyValues("tc.netdut.dialect=mos", "tc.netdut.sku= DCS-7130-48L-R ")
                .run(context -> {
                    DeviceSession unused = new DeviceSession(line -> {
                        throw new AssertionError("device must not be queried: " + line);
                    }, Dialect.MOS, Translators.standard());

                    assertThat(context.getBean(DutConnector.class).identity(unused))
                            .isEqualTo(new DeviceIdentity("DCS-7130-48L-R", Dialect.MOS));
                });
    }

    @Test
    void console_session_needs_url() {
        runner.run(context -> assertThatThrownBy(() -> context.getBean(DutConnector.class).openConsoleSession())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tc.netdut.console.url"));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTranslatorConfig {

        @Bean
        Translator translator() {
            return Translators.standard().toBuilder()
                    .rules(Dialect.of("sonic"), RuleTable.builder().rule("show version", "show version detail").build())
                    .build();
        }
    }
}
