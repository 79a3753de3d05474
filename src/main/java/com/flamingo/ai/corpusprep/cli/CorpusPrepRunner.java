package com.flamingo.ai.corpusprep.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/** Runs {@link PrepareCorpusCommand} with the application arguments once the context is up. */
@Component
@RequiredArgsConstructor
public class CorpusPrepRunner implements CommandLineRunner, ExitCodeGenerator {

  private final PrepareCorpusCommand prepareCorpusCommand;
  private final IFactory factory;

  private int exitCode;

  @Override
  public void run(String... args) {
    exitCode = new CommandLine(prepareCorpusCommand, factory).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
