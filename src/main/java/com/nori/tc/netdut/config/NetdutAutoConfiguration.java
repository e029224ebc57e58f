package com.nori.tc.netdut.config;

import com.nori.tc.netdut.poll.Poller;
import com.nori.tc.netdut.translate.Translator;
import com.nori.tc.netdut.translate.Translators;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * tc.netdut 자동 구성.
 *
 * - Translator: 사용자가 Bean을 등록하면 그것을 쓴다. 없으면 Translators.standard().
 * - Poller: tc.netdut.defaults.* 값으로 만든다.
 * - DutConnector: dialect 검증 실패 시 컨텍스트 기동이 실패한다.
 */
@AutoConfiguration
@EnableConfigurationProperties(NetdutProperties.class)
public class NetdutAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Translator netdutTranslator() {
        return Translators.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public Poller netdutPoller(NetdutProperties props) {
        NetdutProperties.Defaults d = props.getDefaults();
        return new Poller(Duration.ofSeconds(d.getWaitTimeoutSec()), Duration.ofMillis(d.getPollIntervalMs()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DutConnector dutConnector(NetdutProperties props, Translator translator, Poller poller) {
        return new DutConnector(props, translator, poller);
    }
}
