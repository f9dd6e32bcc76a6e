package com.metabuild.generator.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings accumulated during a compilation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
  private final List<Diagnostic> warnings = new ArrayList<>();

  public List<UnusedVariableWarning> getUnusedVariableWarnings() {
	  List<UnusedVariableWarning> result = new ArrayList<>();
	  for (Diagnostic d : warnings) {
		  if (d instanceof UnusedVariableWarning w) {
			  result.add(w);
		  }
	  }
	  return result;
  }
}
