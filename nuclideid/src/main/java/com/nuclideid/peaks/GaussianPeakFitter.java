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

package com.nuclideid.peaks;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Refines detected peaks by fitting a Gaussian in a fixed energy window around each one.  The lowest count in the
 * window is taken as a flat baseline and removed before fitting.
 */
public class GaussianPeakFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GaussianPeakFitter.class);

  public static final double DEFAULT_WINDOW_KEV = 10.0;
  private static final int MIN_WINDOW_POINTS = 5;
  // Four free parameters: amplitude, centroid, sigma and the baseline.
  private static final int FREE_PARAMETERS = 4;
  private static final int MAX_ITERATIONS = 1000;

  private final double windowKeV;

  public GaussianPeakFitter(double windowKeV) {
    if (windowKeV <= 0.0) {
      throw new IllegalArgumentException(String.format("Fit window must be positive, got %f keV", windowKeV));
    }
    this.windowKeV = windowKeV;
  }

  public GaussianPeakFitter() {
    this(DEFAULT_WINDOW_KEV);
  }

  /**
   * Fit every peak in {@code peaks}.  Peaks whose window is too narrow or whose fit fails to converge are skipped.
   */
  public List<FittedPeak> fit(double[] energies, double[] counts, PeakList peaks) {
    List<FittedPeak> results = new ArrayList<>(peaks.size());
    for (Peak peak : peaks.getAllPeaks()) {
      FittedPeak fitted = fitOne(energies, counts, peak.getEnergyKeV());
      if (fitted != null) {
        results.add(fitted);
      }
    }
    return results;
  }

  /**
   * Fit a single Gaussian centred near {@code centerKeV}.
   * @return The fit, or null if it could not be computed.
   */
  public FittedPeak fitOne(double[] energies, double[] counts, double centerKeV) {
    List<double[]> window = new ArrayList<>();
    double baseline = Double.MAX_VALUE;
    for (int i = 0; i < energies.length; i++) {
      if (energies[i] >= centerKeV - windowKeV && energies[i] <= centerKeV + windowKeV) {
        window.add(new double[] {energies[i], counts[i]});
        baseline = Math.min(baseline, counts[i]);
      }
    }

    if (window.size() < MIN_WINDOW_POINTS) {
      LOGGER.warn("Only %d points within %.1f keV of %.1f keV, skipping fit", window.size(), windowKeV, centerKeV);
      return null;
    }

    WeightedObservedPoints points = new WeightedObservedPoints();
    for (double[] xy : window) {
      points.add(xy[0], xy[1] - baseline);
    }

    double[] params;
    try {
      params = GaussianCurveFitter.create().withMaxIterations(MAX_ITERATIONS).fit(points.toList());
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      LOGGER.warn("Gaussian fit at %.1f keV failed: %s", centerKeV, e.getMessage());
      return null;
    }

    double amplitude = params[0];
    double mean = params[1];
    double sigma = params[2];

    double sumSquares = 0.0;
    for (WeightedObservedPoint p : points.toList()) {
      double model = amplitude * Math.exp(-Math.pow(p.getX() - mean, 2) / (2.0 * sigma * sigma));
      sumSquares += Math.pow(p.getY() - model, 2);
    }
    int degreesOfFreedom = window.size() - FREE_PARAMETERS;
    double reducedChiSquared = degreesOfFreedom > 0 ? sumSquares / degreesOfFreedom : Double.NaN;

    return new FittedPeak(mean, sigma, amplitude, baseline, reducedChiSquared);
  }
}
