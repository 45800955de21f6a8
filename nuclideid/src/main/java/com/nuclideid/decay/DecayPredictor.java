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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Predicts how the activity of a nuclide and its descendants evolves over time.
 *
 * The sequence starting at the requested nuclide is solved with {@link BatemanSolver} up to the first member whose
 * half-life is unknown.  That member and everything below it cannot be fed by the solved part, so each is evolved
 * on its own as A(t) = A(0) * exp(-l t) (held constant when l itself is unknown), and the prediction is flagged as
 * degraded.  Initial activities given for several members are superposed: each one seeds its own sub-chain.
 */
public class DecayPredictor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DecayPredictor.class);

  private final DecayDataTable table;
  private final BatemanSolver solver;

  public DecayPredictor(DecayDataTable table) {
    this(table, new BatemanSolver());
  }

  public DecayPredictor(DecayDataTable table, BatemanSolver solver) {
    this.table = table;
    this.solver = solver;
  }

  /**
   * Predict the sequence below {@code start}, with only {@code start} present at t = 0.
   */
  public DecayPrediction predict(Nuclide start, double initialActivityBq, TimeGrid grid) {
    return predict(start, Collections.singletonMap(start, initialActivityBq), grid);
  }

  /**
   * Predict the sequence below {@code start} from the given initial activities (Bq), which may include any of its
   * members.  Members without an entry start at zero.
   */
  public DecayPrediction predict(Nuclide start, Map<Nuclide, Double> initialActivities, TimeGrid grid) {
    for (Map.Entry<Nuclide, Double> entry : initialActivities.entrySet()) {
      Double activity = entry.getValue();
      if (activity == null || !(activity >= 0.0) || Double.isInfinite(activity)) {
        throw new IllegalArgumentException(String.format(
            "Initial activity of %s must be finite and non-negative, got %s", entry.getKey(), activity));
      }
    }

    double[] times = grid.getPoints();
    List<ChainMember> members = table.sequenceFrom(start);
    if (members.isEmpty()) {
      LOGGER.warn("No decay data for %s, returning an empty prediction", start);
      return DecayPrediction.unknown(start, times);
    }

    int n = members.size();
    double[] initial = new double[n];
    for (int k = 0; k < n; k++) {
      initial[k] = initialActivities.getOrDefault(members.get(k).getNuclide(), 0.0);
    }
    for (Nuclide nuclide : initialActivities.keySet()) {
      if (members.stream().noneMatch(m -> m.getNuclide().equals(nuclide))) {
        LOGGER.warn("Ignoring initial activity for %s, which is not below %s", nuclide, start);
      }
    }

    int solvable = 0;
    while (solvable < n && members.get(solvable).hasKnownHalfLife()) {
      solvable++;
    }
    if (solvable < n) {
      LOGGER.warn("No half-life for %s; it and the %d members below it are evolved independently",
          members.get(solvable).getNuclide(), n - solvable - 1);
    }

    double[] lambdas = new double[solvable];
    double[] branching = new double[solvable];
    for (int k = 0; k < solvable; k++) {
      lambdas[k] = members.get(k).getDecayConstant();
      branching[k] = members.get(k).getBranchingToNext();
    }

    double[][] activities = new double[n][times.length];
    for (int source = 0; source < solvable; source++) {
      if (initial[source] <= 0.0) {
        continue;
      }
      double[] subLambdas = Arrays.copyOfRange(lambdas, source, solvable);
      double[] subBranching = Arrays.copyOfRange(branching, source, solvable);
      for (int step = 0; step < times.length; step++) {
        double[] contribution = solver.activities(subLambdas, subBranching, initial[source], times[step]);
        for (int k = 0; k < contribution.length; k++) {
          activities[source + k][step] += contribution[k];
        }
      }
    }

    for (int k = solvable; k < n; k++) {
      double lambda = members.get(k).getDecayConstant();
      for (int step = 0; step < times.length; step++) {
        activities[k][step] = initial[k] * Math.exp(-lambda * times[step]);
      }
    }

    List<ActivityTimeSeries> series = new ArrayList<>(n);
    for (int k = 0; k < n; k++) {
      series.add(new ActivityTimeSeries(members.get(k).getNuclide(), times, activities[k], k >= solvable));
    }
    DecayPrediction.Status status = solvable < n ? DecayPrediction.Status.DEGRADED : DecayPrediction.Status.OK;
    LOGGER.debug("Predicted %d members below %s over %d time points (%s)", n, start, times.length, status);
    return new DecayPrediction(start, status, times, series);
  }
}
