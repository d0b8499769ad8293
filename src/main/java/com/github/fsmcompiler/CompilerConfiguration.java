package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * This class encapsulates all the configuration parameters for the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. if no clock frequency is set, the generated timers assume a 1 kHz tick, ie. one cycle per
 * millisecond.<br>
 * 2. extra output domains are consulted after the built-in DIGITAL, INDICATOR and TIMER domains
 * when inferring a signal's domain.<br>
 * 3. with warningsAsErrors set, any warning blocks code generation just like an error would.<br>
 */
public final class CompilerConfiguration {
  private static final Pattern moduleNamePattern = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String moduleName;
  private final long clockHz;
  private final EncodingStyle encoding;
  private final boolean resetActiveLow;
  private final int numericVariableWidth;
  private final List<OutputDomain> extraOutputDomains;
  private final boolean warningsAsErrors;

  public String getModuleName() {
    return moduleName;
  }

  public long getClockHz() {
    return clockHz;
  }

  public EncodingStyle getEncoding() {
    return encoding;
  }

  public boolean isResetActiveLow() {
    return resetActiveLow;
  }

  public int getNumericVariableWidth() {
    return numericVariableWidth;
  }

  public List<OutputDomain> getExtraOutputDomains() {
    return extraOutputDomains;
  }

  /**
   * Built-in domains followed by the extra ones, in the order they are tried during inference.
   */
  public List<OutputDomain> getOutputDomains() {
    final List<OutputDomain> domains = new ArrayList<>(OutputDomain.builtIns());
    domains.addAll(extraOutputDomains);
    return Collections.unmodifiableList(domains);
  }

  public boolean isWarningsAsErrors() {
    return warningsAsErrors;
  }

  public final static class CompilerConfigurationBuilder {
    private String moduleName;
    private long clockHz;
    private EncodingStyle encoding;
    private boolean resetActiveLow;
    private int numericVariableWidth;
    private final List<OutputDomain> extraOutputDomains = new ArrayList<>();
    private boolean warningsAsErrors;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder moduleName(final String moduleName) {
      this.moduleName = moduleName;
      return this;
    }

    public CompilerConfigurationBuilder clockHz(final long clockHz) {
      this.clockHz = clockHz;
      return this;
    }

    public CompilerConfigurationBuilder encoding(final EncodingStyle encoding) {
      this.encoding = encoding;
      return this;
    }

    public CompilerConfigurationBuilder resetActiveLow(final boolean resetActiveLow) {
      this.resetActiveLow = resetActiveLow;
      return this;
    }

    public CompilerConfigurationBuilder numericVariableWidth(final int numericVariableWidth) {
      this.numericVariableWidth = numericVariableWidth;
      return this;
    }

    public CompilerConfigurationBuilder outputDomain(final OutputDomain outputDomain) {
      this.extraOutputDomains.add(outputDomain);
      return this;
    }

    public CompilerConfigurationBuilder warningsAsErrors(final boolean warningsAsErrors) {
      this.warningsAsErrors = warningsAsErrors;
      return this;
    }

    public CompilerConfiguration build() throws CompilerException {
      final CompilerConfiguration config = new CompilerConfiguration(moduleName, clockHz,
          encoding, resetActiveLow, numericVariableWidth, extraOutputDomains, warningsAsErrors);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws CompilerException {
    StringBuilder messages = new StringBuilder();
    if (!moduleNamePattern.matcher(moduleName).matches()) {
      messages.append("Module name ").append(moduleName)
          .append(" is not a valid Verilog identifier. ");
    }
    if (numericVariableWidth > 64) {
      messages.append("Numeric variable width cannot exceed 64 bits. ");
    }
    final Set<String> domainNames = new HashSet<>();
    for (final OutputDomain domain : getOutputDomains()) {
      if (domain == null) {
        messages.append("Output domain cannot be null. ");
      } else if (domain.isOpen()) {
        messages.append("Output domain ").append(domain.getName())
            .append(" must be closed to be registered. ");
      } else if (!domainNames.add(domain.getName())) {
        messages.append("Output domain ").append(domain.getName())
            .append(" is registered twice. ");
      }
    }
    if (messages.length() > 0) {
      throw new CompilerException(CompilerException.Code.INVALID_COMPILER_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [moduleName=" + moduleName + ", clockHz=" + clockHz
        + ", encoding=" + encoding + ", resetActiveLow=" + resetActiveLow
        + ", numericVariableWidth=" + numericVariableWidth + ", extraOutputDomains="
        + extraOutputDomains.size() + ", warningsAsErrors=" + warningsAsErrors + "]";
  }

  private CompilerConfiguration(final String moduleName, final long clockHz,
      final EncodingStyle encoding, final boolean resetActiveLow, final int numericVariableWidth,
      final List<OutputDomain> extraOutputDomains, final boolean warningsAsErrors) {
    this.moduleName = moduleName == null ? "fsm" : moduleName;
    if (clockHz <= 0L) {
      this.clockHz = 1000L;
    } else {
      this.clockHz = clockHz;
    }
    this.encoding = encoding == null ? EncodingStyle.AUTO : encoding;
    this.resetActiveLow = resetActiveLow;
    if (numericVariableWidth <= 0) {
      this.numericVariableWidth = 8;
    } else {
      this.numericVariableWidth = numericVariableWidth;
    }
    this.extraOutputDomains = Collections.unmodifiableList(new ArrayList<>(extraOutputDomains));
    this.warningsAsErrors = warningsAsErrors;
  }

}
