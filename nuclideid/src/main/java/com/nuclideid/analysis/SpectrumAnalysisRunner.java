/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.nuclideid.analysis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.isotopes.IsotopeRegistry;
import com.nuclideid.isotopes.RegistryLoadException;
import com.nuclideid.spectrum.Spectrum;
import com.nuclideid.spectrum.SpectrumDocument;
import com.nuclideid.spectrum.SpectrumValidationException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzes one spectrum document and writes the analysis report as JSON.
 */
public class SpectrumAnalysisRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumAnalysisRunner.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_MODE = "m";
  public static final String OPTION_PROFILE = "p";
  public static final String OPTION_USER_ISOTOPES = "u";
  public static final String OPTION_SNIP = "s";
  public static final String OPTION_FIT_PEAKS = "f";
  public static final String OPTION_DYNAMIC_TOLERANCE = "d";
  public static final String OPTION_CHANNELS = "c";
  public static final String OPTION_BACKGROUND = "b";
  public static final String OPTION_EXTERNAL_SCORES = "x";
  public static final String OPTION_FUSED_OUTPUT = "F";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class finds peaks in a gamma spectrum, scores candidate isotopes against them, builds natural decay ",
      "series hypotheses and writes everything as a JSON report.  The input is a JSON document of the form ",
      "{\"counts\": [...], \"calibration\": {\"slope\": ..., \"intercept\": ...}, \"live_time_s\": ...}."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("spectrum file")
        .desc("A JSON spectrum document to analyze")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output file")
        .desc("Where to write the JSON report")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_MODE)
        .argName("mode")
        .desc("The threshold profile to use: strict (default) or robust")
        .hasArg()
        .longOpt("mode")
    );
    add(Option.builder(OPTION_PROFILE)
        .argName("profile file")
        .desc("A JSON file of profile fields that override the mode's defaults")
        .hasArg()
        .longOpt("profile")
    );
    add(Option.builder(OPTION_USER_ISOTOPES)
        .argName("isotope file")
        .desc("A JSON file of user-defined isotopes to merge over the bundled library")
        .hasArg()
        .longOpt("user-isotopes")
    );
    add(Option.builder(OPTION_SNIP)
        .argName("snip")
        .desc("Estimate and remove the continuum with SNIP before peak detection")
        .longOpt("snip")
    );
    add(Option.builder(OPTION_FIT_PEAKS)
        .argName("fit peaks")
        .desc("Fit a Gaussian to every detected peak and report the fits")
        .longOpt("fit-peaks")
    );
    add(Option.builder(OPTION_DYNAMIC_TOLERANCE)
        .argName("dynamic tolerance")
        .desc("Scale the energy tolerance with detector resolution instead of using a fixed window")
        .longOpt("dynamic-tolerance")
    );
    add(Option.builder(OPTION_CHANNELS)
        .argName("channel count")
        .desc("Pad or truncate the spectrum to this many channels; by default its own length is kept")
        .hasArg()
        .longOpt("channels")
    );
    add(Option.builder(OPTION_BACKGROUND)
        .argName("background file")
        .desc("A measured background spectrum document to subtract, scaled by the ratio of live times")
        .hasArg()
        .longOpt("background")
    );
    add(Option.builder(OPTION_EXTERNAL_SCORES)
        .argName("scores file")
        .desc("A JSON list of {\"isotope\", \"confidence\"} scores from an external classifier to fuse with the " +
            "peak-matching candidates")
        .hasArg()
        .longOpt("external-scores")
    );
    add(Option.builder(OPTION_FUSED_OUTPUT)
        .argName("fused output file")
        .desc("Where to write the fused scores; required with -x")
        .hasArg()
        .longOpt("fused-output")
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  public static void main(String[] args) throws Exception {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }

    CommandLine cl = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      System.err.format("Argument parsing failed: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(SpectrumAnalysisRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(SpectrumAnalysisRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    if (cl.hasOption(OPTION_EXTERNAL_SCORES) != cl.hasOption(OPTION_FUSED_OUTPUT)) {
      System.err.format("Options -%s and -%s must be given together\n", OPTION_EXTERNAL_SCORES, OPTION_FUSED_OUTPUT);
      HELP_FORMATTER.printHelp(SpectrumAnalysisRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    AnalysisMode mode;
    try {
      mode = AnalysisMode.valueOf(cl.getOptionValue(OPTION_MODE, "strict").toUpperCase());
    } catch (IllegalArgumentException e) {
      System.err.format("Unknown mode '%s', expected strict or robust\n", cl.getOptionValue(OPTION_MODE));
      System.exit(1);
      return;
    }

    AnalysisProfile profile = mode.defaultProfile();
    if (cl.hasOption(OPTION_PROFILE)) {
      profile.override(new File(cl.getOptionValue(OPTION_PROFILE)));
    }
    if (cl.hasOption(OPTION_SNIP)) {
      profile.setSubtractBackground(true);
    }
    if (cl.hasOption(OPTION_FIT_PEAKS)) {
      profile.setFitPeaks(true);
    }
    if (cl.hasOption(OPTION_DYNAMIC_TOLERANCE)) {
      profile.setDynamicTolerance(true);
    }

    IsotopeRegistry registry;
    try {
      registry = IsotopeRegistry.load(
          cl.hasOption(OPTION_USER_ISOTOPES) ? new File(cl.getOptionValue(OPTION_USER_ISOTOPES)) : null);
    } catch (RegistryLoadException e) {
      LOGGER.error("Unable to load the isotope library: %s", e.getMessage());
      System.exit(1);
      return;
    }

    AnalysisReport report;
    try {
      SpectrumDocument document = SpectrumDocument.read(new File(cl.getOptionValue(OPTION_INPUT)));
      Spectrum spectrum = toSpectrum(document, cl);
      SpectrumAnalyzer analyzer = new SpectrumAnalyzer(registry, profile);
      if (cl.hasOption(OPTION_BACKGROUND)) {
        SpectrumDocument backgroundDocument = SpectrumDocument.read(new File(cl.getOptionValue(OPTION_BACKGROUND)));
        report = analyzer.analyze(spectrum, toSpectrum(backgroundDocument, cl), scalingFactor(document,
            backgroundDocument));
      } else {
        report = analyzer.analyze(spectrum);
      }
    } catch (SpectrumValidationException e) {
      LOGGER.error("Invalid spectrum: %s", e.getMessage());
      System.exit(1);
      return;
    }

    try (FileOutputStream fos = new FileOutputStream(cl.getOptionValue(OPTION_OUTPUT))) {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(fos, report);
    }
    LOGGER.info("Wrote %d candidates and %d chain hypotheses to %s", report.getIdentificationCandidates().size(),
        report.getChainCandidates().size(), cl.getOptionValue(OPTION_OUTPUT));

    if (cl.hasOption(OPTION_EXTERNAL_SCORES)) {
      List<ExternalScore> external = OBJECT_MAPPER.readValue(new File(cl.getOptionValue(OPTION_EXTERNAL_SCORES)),
          new TypeReference<List<ExternalScore>>() {});
      List<FusedScore> fused = new HybridScoreFusion().fuse(report.getRawCandidates(), external);
      try (FileOutputStream fos = new FileOutputStream(cl.getOptionValue(OPTION_FUSED_OUTPUT))) {
        OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(fos, fused);
      }
      LOGGER.info("Wrote %d fused scores to %s", fused.size(), cl.getOptionValue(OPTION_FUSED_OUTPUT));
    }
  }

  private static Spectrum toSpectrum(SpectrumDocument document, CommandLine cl)
      throws SpectrumValidationException {
    if (!cl.hasOption(OPTION_CHANNELS)) {
      return document.toSpectrum();
    }
    try {
      return document.toSpectrum(Integer.parseInt(cl.getOptionValue(OPTION_CHANNELS)));
    } catch (NumberFormatException e) {
      throw new SpectrumValidationException(
          String.format("Channel count must be an integer, got '%s'", cl.getOptionValue(OPTION_CHANNELS)), e);
    }
  }

  // Live-time ratio when both documents carry one, otherwise the background is taken as is.
  static double scalingFactor(SpectrumDocument source, SpectrumDocument background) {
    if (source.getLiveTimeSeconds() == null || background.getLiveTimeSeconds() == null ||
        !(background.getLiveTimeSeconds() > 0.0)) {
      LOGGER.warn("No usable live times for source and background; subtracting the background unscaled");
      return 1.0;
    }
    return source.getLiveTimeSeconds() / background.getLiveTimeSeconds();
  }
}
