package com.github.sherter.oftee.proxy;

import com.beust.jcommander.IDefaultProvider;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;

/**
 * Supplies option values that were not given on the command line: first from the environment
 * variable named after the option ({@code --listen-on} is {@code LISTEN_ON}), then from a
 * built-in default.
 */
class EnvironmentDefaultProvider implements IDefaultProvider {

  private final Map<String, String> environment;
  private final Map<String, String> fallbacks;

  EnvironmentDefaultProvider(Map<String, String> environment, Map<String, String> fallbacks) {
    this.environment = ImmutableMap.copyOf(environment);
    this.fallbacks = ImmutableMap.copyOf(fallbacks);
  }

  static String variableName(String optionName) {
    return CharMatcher.is('-')
        .trimLeadingFrom(optionName)
        .replace('-', '_')
        .toUpperCase(Locale.ROOT);
  }

  @Override
  public String getDefaultValueFor(String optionName) {
    String variable = variableName(optionName);
    String value = environment.get(variable);
    return value != null ? value : fallbacks.get(variable);
  }
}
