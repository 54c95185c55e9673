package io.github.riemr.fleet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.fleet.application.util.DurationParser;
import io.github.riemr.fleet.oracle.NeutralScoringOracle;
import io.github.riemr.fleet.oracle.ProcessScoringOracle;
import io.github.riemr.fleet.oracle.ScoringOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class OracleConfig {

    // 空ならモデルなし（中立値）で動かす
    @Value("${fleet.planner.oracle.command:}")
    private String oracleCommand;
    @Value("${fleet.planner.oracle.timeout:PT10S}")
    private String oracleTimeout;
    @Value("${fleet.planner.oracle.max-in-flight:10}")
    private int maxInFlight;

    @Bean
    @ConditionalOnMissingBean(ScoringOracle.class)
    public ScoringOracle scoringOracle(ObjectMapper objectMapper) {
        if (oracleCommand == null || oracleCommand.isBlank()) {
            log.info("No oracle command configured, using neutral scoring oracle");
            return new NeutralScoringOracle();
        }
        List<String> command = Arrays.asList(oracleCommand.trim().split("\\s+"));
        log.info("Using process scoring oracle: {}", command);
        return new ProcessScoringOracle(command, objectMapper,
                DurationParser.parseTolerant(oracleTimeout, Duration.ofSeconds(10)));
    }

    /** 外部呼び出しの同時実行数を max-in-flight に制限する */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService oracleExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, maxInFlight), r -> {
            Thread t = new Thread(r, "oracle-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
