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

package com.nuclideid.roi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.decay.ActivityTimeSeries;
import com.nuclideid.decay.DecayDataTable;
import com.nuclideid.decay.DecayPrediction;
import com.nuclideid.decay.DecayPredictor;
import com.nuclideid.decay.TimeGrid;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Quantifies regions of interest in one spectrum document and writes counts, activities and detection limits as
 * JSON, optionally with a uranium enrichment estimate and the decay-projected activities of each quantified line.
 */
public class RoiAnalysisRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RoiAnalysisRunner.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_DETECTOR = "D";
  public static final String OPTION_REGIONS = "r";
  public static final String OPTION_LIVE_TIME = "t";
  public static final String OPTION_ENRICHMENT = "e";
  public static final String OPTION_PROJECTION_DAYS = "P";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class integrates regions of interest around known gamma lines, subtracts a side band estimate of the ",
      "continuum and converts the net counts to activities with the chosen detector's efficiency curve.  The ",
      "input is the same JSON spectrum document the spectrum analysis runner reads."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("spectrum file")
        .desc("A JSON spectrum document to quantify")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output file")
        .desc("Where to write the JSON results")
        .hasArg().required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_DETECTOR)
        .argName("detector name")
        .desc(String.format("The detector whose efficiency curve to use (default '%s')", RoiLibrary.DEFAULT_DETECTOR))
        .hasArg()
        .longOpt("detector")
    );
    add(Option.builder(OPTION_REGIONS)
        .argName("region names")
        .desc("A comma separated list of regions to quantify, like 'Cs-137 (662 keV)'; all regions by default")
        .hasArg()
        .longOpt("regions")
    );
    add(Option.builder(OPTION_LIVE_TIME)
        .argName("seconds")
        .desc("Live time of the acquisition, overriding the document's live_time_s")
        .hasArg()
        .longOpt("live-time")
    );
    add(Option.builder(OPTION_ENRICHMENT)
        .argName("enrichment")
        .desc("Also classify uranium enrichment from the 186 keV / 93 keV ratio")
        .longOpt("enrichment")
    );
    add(Option.builder(OPTION_PROJECTION_DAYS)
        .argName("days")
        .desc("Project every derived activity and its decay chain this many days ahead")
        .hasArg()
        .longOpt("project-days")
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
      HELP_FORMATTER.printHelp(RoiAnalysisRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(RoiAnalysisRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    RoiLibrary library;
    try {
      library = RoiLibrary.loadBundled();
    } catch (RegistryLoadException e) {
      LOGGER.error("Unable to load the ROI library: %s", e.getMessage());
      System.exit(1);
      return;
    }

    String detectorName = cl.getOptionValue(OPTION_DETECTOR, RoiLibrary.DEFAULT_DETECTOR);
    Optional<DetectorEfficiency> detector = library.getDetector(detectorName);
    if (!detector.isPresent()) {
      System.err.format("Unknown detector '%s'; known detectors are %s\n", detectorName, library.getDetectors());
      System.exit(1);
      return;
    }

    List<RoiDefinition> regions = new ArrayList<>();
    if (cl.hasOption(OPTION_REGIONS)) {
      for (String name : StringUtils.split(cl.getOptionValue(OPTION_REGIONS), ',')) {
        Optional<RoiDefinition> region = library.getRegion(name.trim());
        if (!region.isPresent()) {
          System.err.format("Unknown region '%s'; known regions are %s\n", name.trim(), library.getRegions());
          System.exit(1);
          return;
        }
        regions.add(region.get());
      }
    } else {
      regions.addAll(library.getRegions());
    }

    SpectrumDocument document;
    Spectrum spectrum;
    double liveTime;
    Double projectionDays;
    try {
      document = SpectrumDocument.read(new File(cl.getOptionValue(OPTION_INPUT)));
      spectrum = document.toSpectrum();
      liveTime = cl.hasOption(OPTION_LIVE_TIME) ?
          Double.parseDouble(cl.getOptionValue(OPTION_LIVE_TIME)) : liveTimeOf(document);
      projectionDays = cl.hasOption(OPTION_PROJECTION_DAYS) ?
          Double.valueOf(cl.getOptionValue(OPTION_PROJECTION_DAYS)) : null;
    } catch (SpectrumValidationException e) {
      LOGGER.error("Invalid spectrum: %s", e.getMessage());
      System.exit(1);
      return;
    } catch (NumberFormatException e) {
      System.err.format("Invalid number: %s\n", e.getMessage());
      System.exit(1);
      return;
    }
    if (projectionDays != null && !(projectionDays > 0.0 && Double.isFinite(projectionDays))) {
      System.err.format("Projection horizon must be a positive number of days, got %s\n", projectionDays);
      System.exit(1);
      return;
    }

    RoiAnalyzer analyzer = new RoiAnalyzer(detector.get());
    List<RoiResult> results = new ArrayList<>(regions.size());
    for (RoiDefinition region : regions) {
      results.add(analyzer.analyze(spectrum, region, liveTime));
    }

    UraniumEnrichment enrichment = null;
    if (cl.hasOption(OPTION_ENRICHMENT)) {
      Optional<RoiDefinition> u235 = library.getRegion(RoiAnalyzer.U235_REGION);
      Optional<RoiDefinition> th234 = library.getRegion(RoiAnalyzer.TH234_REGION);
      if (!u235.isPresent() || !th234.isPresent()) {
        LOGGER.error("The ROI library lacks the %s or %s region", RoiAnalyzer.U235_REGION, RoiAnalyzer.TH234_REGION);
        System.exit(1);
        return;
      }
      enrichment = analyzer.analyzeEnrichment(spectrum, u235.get(), th234.get(), liveTime);
    }

    Map<String, Map<String, Double>> projections = null;
    if (projectionDays != null) {
      try {
        projections = project(new DecayPredictor(DecayDataTable.loadBundled()), results, projectionDays);
      } catch (RegistryLoadException e) {
        LOGGER.error("Unable to load decay data: %s", e.getMessage());
        System.exit(1);
        return;
      }
    }

    RoiReport report = new RoiReport(detector.get().getName(), liveTime, results, enrichment, projectionDays,
        projections);
    try (FileOutputStream fos = new FileOutputStream(cl.getOptionValue(OPTION_OUTPUT))) {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(fos, report);
    }
    LOGGER.info("Wrote %d regions of interest to %s", results.size(), cl.getOptionValue(OPTION_OUTPUT));
  }

  private static double liveTimeOf(SpectrumDocument document) {
    if (document.getLiveTimeSeconds() == null) {
      LOGGER.warn("The spectrum has no live time; activities will not be derived");
      return 0.0;
    }
    return document.getLiveTimeSeconds();
  }

  /**
   * Evolve every derived activity forward in time.
   * @return Region name to the activity of each member of the region's decay chain after {@code days}; regions
   *         without an activity or without decay data are left out.
   */
  public static Map<String, Map<String, Double>> project(DecayPredictor predictor, List<RoiResult> results,
                                                         double days) {
    TimeGrid grid = TimeGrid.of(0.0, days * TimeGrid.SECONDS_PER_DAY);
    Map<String, Map<String, Double>> projections = new LinkedHashMap<>();
    for (RoiResult result : results) {
      if (!result.hasActivity()) {
        continue;
      }
      DecayPrediction prediction = predictor.predict(result.getNuclide(), result.getActivityBq(), grid);
      if (prediction.getStatus() == DecayPrediction.Status.UNKNOWN_ISOTOPE) {
        LOGGER.warn("No decay data for %s; %s is not projected", result.getNuclide(), result.getRegion());
        continue;
      }
      Map<String, Double> activities = new LinkedHashMap<>();
      for (ActivityTimeSeries series : prediction.getSeries()) {
        activities.put(series.getIsotope().getName(), series.getActivity(grid.size() - 1));
      }
      projections.put(result.getRegion(), activities);
    }
    return projections;
  }
}
