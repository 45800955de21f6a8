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

package com.nuclideid.decay;

import com.nuclideid.isotopes.Nuclide;
import com.nuclideid.isotopes.RegistryLoadException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes predicted activity curves for a nuclide and its descendants as CSV: one row per time point, with the time
 * in seconds and days followed by one activity column (Bq) per member.
 */
public class DecayCurveExporter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DecayCurveExporter.class);

  public static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.withRecordSeparator('\n');

  public static final String OPTION_ISOTOPE = "i";
  public static final String OPTION_ACTIVITY = "a";
  public static final String OPTION_DURATION_DAYS = "d";
  public static final String OPTION_STEPS = "n";
  public static final String OPTION_LOG_GRID = "l";
  public static final String OPTION_OUTPUT = "o";

  public static final int DEFAULT_STEPS = 50;

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class predicts the activity of a nuclide and every member of its decay chain over time by solving the ",
      "Bateman equations, and writes the curves as CSV."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_ISOTOPE)
        .argName("isotope")
        .desc("The nuclide at the top of the chain, like U-238 or Cs-137")
        .hasArg().required()
        .longOpt("isotope")
    );
    add(Option.builder(OPTION_ACTIVITY)
        .argName("becquerel")
        .desc("Initial activity of that nuclide in Bq")
        .hasArg().required()
        .longOpt("activity")
    );
    add(Option.builder(OPTION_DURATION_DAYS)
        .argName("days")
        .desc("How far ahead to predict, in days")
        .hasArg().required()
        .longOpt("duration-days")
    );
    add(Option.builder(OPTION_STEPS)
        .argName("count")
        .desc(String.format("Number of time points (default %d)", DEFAULT_STEPS))
        .hasArg()
        .longOpt("steps")
    );
    add(Option.builder(OPTION_LOG_GRID)
        .argName("log grid")
        .desc("Space time points logarithmically instead of linearly")
        .longOpt("log")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output path")
        .desc("Where to write the CSV; stdout if omitted")
        .hasArg()
        .longOpt("output")
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
      HELP_FORMATTER.printHelp(DecayCurveExporter.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(DecayCurveExporter.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    Nuclide isotope;
    double activity, durationDays;
    int steps;
    try {
      isotope = Nuclide.of(cl.getOptionValue(OPTION_ISOTOPE));
      activity = Double.parseDouble(cl.getOptionValue(OPTION_ACTIVITY));
      durationDays = Double.parseDouble(cl.getOptionValue(OPTION_DURATION_DAYS));
      steps = cl.hasOption(OPTION_STEPS) ? Integer.parseInt(cl.getOptionValue(OPTION_STEPS)) : DEFAULT_STEPS;
    } catch (IllegalArgumentException e) {
      System.err.format("Invalid argument: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(DecayCurveExporter.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
      return;
    }

    double durationSeconds = durationDays * TimeGrid.SECONDS_PER_DAY;
    TimeGrid grid = cl.hasOption(OPTION_LOG_GRID) ?
        TimeGrid.logarithmic(durationSeconds, steps) : TimeGrid.linear(durationSeconds, steps);

    DecayPrediction prediction;
    try {
      prediction = new DecayPredictor(DecayDataTable.loadBundled()).predict(isotope, activity, grid);
    } catch (RegistryLoadException e) {
      LOGGER.error("Unable to load decay data: %s", e.getMessage());
      System.exit(1);
      return;
    }

    if (prediction.getStatus() == DecayPrediction.Status.UNKNOWN_ISOTOPE) {
      System.err.format("No decay data is available for %s\n", isotope);
      System.exit(1);
    }

    if (cl.hasOption(OPTION_OUTPUT)) {
      try (Writer writer = new FileWriter(cl.getOptionValue(OPTION_OUTPUT))) {
        writeCsv(prediction, writer);
      }
      LOGGER.info("Wrote %d time points for %d nuclides to %s", grid.size(), prediction.getSeries().size(),
          cl.getOptionValue(OPTION_OUTPUT));
    } else {
      Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      writeCsv(prediction, writer);
      writer.flush();
    }
  }

  public static void writeCsv(DecayPrediction prediction, Writer writer) throws IOException {
    List<String> header = new ArrayList<>();
    header.add("time_s");
    header.add("time_days");
    for (ActivityTimeSeries series : prediction.getSeries()) {
      header.add(series.getIsotope().getName() + "_bq");
    }

    CSVPrinter printer = new CSVPrinter(writer, CSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
    double[] times = prediction.getTimePointsSeconds();
    for (int step = 0; step < times.length; step++) {
      List<Object> row = new ArrayList<>(header.size());
      row.add(times[step]);
      row.add(times[step] / TimeGrid.SECONDS_PER_DAY);
      for (ActivityTimeSeries series : prediction.getSeries()) {
        row.add(series.getActivity(step));
      }
      printer.printRecord(row);
    }
    printer.flush();
  }
}
