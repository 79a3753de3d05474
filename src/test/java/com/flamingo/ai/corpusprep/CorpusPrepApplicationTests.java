package com.flamingo.ai.corpusprep;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.corpusprep.cli.CorpusPrepRunner;
import com.flamingo.ai.corpusprep.config.CorpusConfig;
import com.flamingo.ai.corpusprep.service.chunk.TokenEstimatorType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Loads the full context and runs the command with {@code --help}. */
@SpringBootTest(args = "--help", properties = "spring.main.web-application-type=none")
class CorpusPrepApplicationTests {

  @Autowired private CorpusPrepRunner runner;
  @Autowired private CorpusConfig corpusConfig;

  @Test
  void contextLoads() {
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void bindsDefaultsFromApplicationYaml() {
    assertThat(corpusConfig.getChunking().getMaxTokens()).isEqualTo(500);
    assertThat(corpusConfig.getChunking().getOverlapSentences()).isEqualTo(2);
    assertThat(corpusConfig.getChunking().getTokenEstimator()).isEqualTo(TokenEstimatorType.WORDS);
    assertThat(corpusConfig.getJsonl().getTextKey()).isEqualTo("text");
    assertThat(corpusConfig.getPipeline().getWorkers()).isEqualTo(1);
  }
}
