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

import com.nuclideid.isotopes.IsotopeRegistry;
import com.nuclideid.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes analysis reports by spectrum (counts and calibration) and mode.  At most one analysis per key is ever in
 * flight: callers that arrive while it runs wait for and share its result.  Failed analyses are not cached.
 */
public class CachingSpectrumAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CachingSpectrumAnalyzer.class);

  public static final int DEFAULT_MAX_ENTRIES = 256;

  private final Map<AnalysisMode, SpectrumAnalyzer> analyzers;
  private final int maxEntries;
  private final ConcurrentHashMap<Key, CompletableFuture<AnalysisReport>> cache = new ConcurrentHashMap<>();

  public CachingSpectrumAnalyzer(Map<AnalysisMode, SpectrumAnalyzer> analyzers, int maxEntries) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException(String.format("Cache must hold at least one entry, got %d", maxEntries));
    }
    this.analyzers = new EnumMap<>(analyzers);
    this.maxEntries = maxEntries;
  }

  /**
   * Cache over the default profile of every mode.
   */
  public CachingSpectrumAnalyzer(IsotopeRegistry registry) {
    this(defaultAnalyzers(registry), DEFAULT_MAX_ENTRIES);
  }

  private static Map<AnalysisMode, SpectrumAnalyzer> defaultAnalyzers(IsotopeRegistry registry) {
    Map<AnalysisMode, SpectrumAnalyzer> analyzers = new EnumMap<>(AnalysisMode.class);
    for (AnalysisMode mode : AnalysisMode.values()) {
      analyzers.put(mode, new SpectrumAnalyzer(registry, mode));
    }
    return analyzers;
  }

  public AnalysisReport analyze(Spectrum spectrum, AnalysisMode mode) {
    SpectrumAnalyzer analyzer = analyzers.get(mode);
    if (analyzer == null) {
      throw new IllegalArgumentException(String.format("No analyzer is configured for mode %s", mode));
    }

    Key key = new Key(spectrum, mode);
    CompletableFuture<AnalysisReport> pending = new CompletableFuture<>();
    CompletableFuture<AnalysisReport> existing = cache.putIfAbsent(key, pending);
    if (existing != null) {
      LOGGER.debug("Reusing %s analysis of a %d channel spectrum", mode, spectrum.size());
      return await(existing);
    }

    evictIfFull();
    try {
      pending.complete(analyzer.analyze(spectrum));
    } catch (Throwable t) {
      // Errors too: an entry left incomplete would block every later caller for this key.
      cache.remove(key, pending);
      pending.completeExceptionally(t);
      throw t;
    }
    return pending.join();
  }

  private static AnalysisReport await(CompletableFuture<AnalysisReport> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      if (e.getCause() instanceof Error) {
        throw (Error) e.getCause();
      }
      throw e;
    }
  }

  // Drop finished entries until there is room; in-flight ones are never evicted.
  private void evictIfFull() {
    Iterator<Map.Entry<Key, CompletableFuture<AnalysisReport>>> it = cache.entrySet().iterator();
    while (cache.size() > maxEntries && it.hasNext()) {
      if (it.next().getValue().isDone()) {
        it.remove();
      }
    }
  }

  public int size() {
    return cache.size();
  }

  public void invalidateAll() {
    cache.clear();
  }

  private static class Key {
    private final Spectrum spectrum;
    private final AnalysisMode mode;

    Key(Spectrum spectrum, AnalysisMode mode) {
      this.spectrum = spectrum;
      this.mode = mode;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      Key key = (Key) o;
      return mode == key.mode && spectrum.equals(key.spectrum);
    }

    @Override
    public int hashCode() {
      return Objects.hash(spectrum, mode);
    }
  }
}
