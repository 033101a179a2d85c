package com.materialport.converter.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated during a conversion run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ConversionDiagnostics {
  private final List<Diagnostic> errors = new ArrayList<>();
  private final List<Diagnostic> warnings = new ArrayList<>();
  private final List<Diagnostic> infos = new ArrayList<>();

  public void error(DiagnosticKind kind, String subject, String message) {
	  errors.add(new Diagnostic(kind, message, subject));
  }

  public void warn(DiagnosticKind kind, String subject, String message) {
	  warnings.add(new Diagnostic(kind, message, subject));
  }

  public void info(DiagnosticKind kind, String subject, String message) {
	  infos.add(new Diagnostic(kind, message, subject));
  }

  public boolean hasErrors() {
	  return !this.errors.isEmpty();
  }

  public List<Diagnostic> all() {
	  List<Diagnostic> all = new ArrayList<>(errors);
	  all.addAll(warnings);
	  all.addAll(infos);
	  return all;
  }

  public long count(DiagnosticKind kind) {
	  return all().stream().filter(d -> d.getKind() == kind).count();
  }
}
