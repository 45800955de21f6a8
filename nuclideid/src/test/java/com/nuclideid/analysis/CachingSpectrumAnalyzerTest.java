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

import com.nuclideid.chains.DecaySeries;
import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.spectrum.Spectrum;
import com.nuclideid.spectrum.SyntheticSpectra;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CachingSpectrumAnalyzerTest {
  private SpectrumAnalyzer strict;
  private SpectrumAnalyzer robust;
  private Spectrum spectrum;

  private static AnalysisReport report(AnalysisMode mode) {
    return new AnalysisReport(mode, AnalysisProfile.DEFAULT_VERSION, Collections.emptyList(), null,
        Collections.<IdentificationCandidate>emptyList(), Collections.<IdentificationCandidate>emptyList(),
        Collections.emptyList(), EnumSet.noneOf(DecaySeries.class), null);
  }

  private CachingSpectrumAnalyzer cache(int maxEntries) {
    Map<AnalysisMode, SpectrumAnalyzer> analyzers = new EnumMap<>(AnalysisMode.class);
    analyzers.put(AnalysisMode.STRICT, strict);
    analyzers.put(AnalysisMode.ROBUST, robust);
    return new CachingSpectrumAnalyzer(analyzers, maxEntries);
  }

  @Before
  public void setUp() throws Exception {
    strict = mock(SpectrumAnalyzer.class);
    robust = mock(SpectrumAnalyzer.class);
    spectrum = SyntheticSpectra.spectrum(SyntheticSpectra.flat(64, 3));
  }

  @Test
  public void testRepeatedRequestsAreServedFromTheCache() throws Exception {
    AnalysisReport expected = report(AnalysisMode.STRICT);
    when(strict.analyze(spectrum)).thenReturn(expected);
    CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    assertSame(expected, cache.analyze(spectrum, AnalysisMode.STRICT));
    Spectrum equalCopy = SyntheticSpectra.spectrum(SyntheticSpectra.flat(64, 3));
    assertSame("Equal spectra share an entry", expected, cache.analyze(equalCopy, AnalysisMode.STRICT));
    verify(strict, times(1)).analyze(spectrum);
    assertEquals(1, cache.size());
  }

  @Test
  public void testModesAreCachedSeparately() throws Exception {
    when(strict.analyze(spectrum)).thenReturn(report(AnalysisMode.STRICT));
    when(robust.analyze(spectrum)).thenReturn(report(AnalysisMode.ROBUST));
    CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    assertEquals(AnalysisMode.STRICT, cache.analyze(spectrum, AnalysisMode.STRICT).getMode());
    assertEquals(AnalysisMode.ROBUST, cache.analyze(spectrum, AnalysisMode.ROBUST).getMode());
    assertEquals(2, cache.size());
  }

  @Test
  public void testConcurrentCallersShareOneAnalysis() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AnalysisReport expected = report(AnalysisMode.STRICT);
    when(strict.analyze(spectrum)).thenAnswer(invocation -> {
      started.countDown();
      release.await(10, TimeUnit.SECONDS);
      return expected;
    });
    final CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      Future<AnalysisReport> first = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      assertTrue(started.await(10, TimeUnit.SECONDS));
      Future<AnalysisReport> second = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      Future<AnalysisReport> third = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      release.countDown();

      assertSame(expected, first.get(10, TimeUnit.SECONDS));
      assertSame(expected, second.get(10, TimeUnit.SECONDS));
      assertSame(expected, third.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
    verify(strict, times(1)).analyze(spectrum);
  }

  @Test
  public void testFailuresAreNotCached() throws Exception {
    AnalysisReport expected = report(AnalysisMode.STRICT);
    when(strict.analyze(spectrum)).thenThrow(new IllegalStateException("detector offline")).thenReturn(expected);
    CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    try {
      cache.analyze(spectrum, AnalysisMode.STRICT);
      fail("The first analysis should have failed");
    } catch (IllegalStateException e) {
      assertEquals("detector offline", e.getMessage());
    }
    assertEquals(0, cache.size());

    assertSame(expected, cache.analyze(spectrum, AnalysisMode.STRICT));
    verify(strict, times(2)).analyze(spectrum);
  }

  @Test
  public void testErrorsAreNotCachedAndDoNotBlockLaterCallers() throws Exception {
    AnalysisReport expected = report(AnalysisMode.STRICT);
    when(strict.analyze(spectrum)).thenThrow(new StackOverflowError("deep")).thenReturn(expected);
    final CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    try {
      cache.analyze(spectrum, AnalysisMode.STRICT);
      fail("The first analysis should have failed");
    } catch (StackOverflowError e) {
      assertEquals("deep", e.getMessage());
    }
    assertEquals("A failed analysis leaves no entry behind", 0, cache.size());

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<AnalysisReport> retry = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      assertSame(expected, retry.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
    verify(strict, times(2)).analyze(spectrum);
  }

  @Test
  public void testWaitingCallersReceiveTheError() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    when(strict.analyze(spectrum)).thenAnswer(invocation -> {
      started.countDown();
      release.await(10, TimeUnit.SECONDS);
      throw new AssertionError("fit diverged");
    });
    final CachingSpectrumAnalyzer cache = cache(CachingSpectrumAnalyzer.DEFAULT_MAX_ENTRIES);

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<AnalysisReport> first = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      assertTrue(started.await(10, TimeUnit.SECONDS));
      Future<AnalysisReport> waiter = executor.submit(() -> cache.analyze(spectrum, AnalysisMode.STRICT));
      // Give the waiter time to join the in-flight analysis.
      Thread.sleep(200);
      release.countDown();

      for (Future<AnalysisReport> future : Arrays.asList(first, waiter)) {
        try {
          future.get(10, TimeUnit.SECONDS);
          fail("Every caller should see the failure");
        } catch (ExecutionException e) {
          assertTrue(e.getCause() instanceof AssertionError);
          assertEquals("fit diverged", e.getCause().getMessage());
        }
      }
    } finally {
      executor.shutdownNow();
    }
    assertEquals(0, cache.size());
  }

  @Test
  public void testFinishedEntriesAreEvictedWhenFull() throws Exception {
    Spectrum other = SyntheticSpectra.spectrum(SyntheticSpectra.flat(64, 4));
    when(strict.analyze(spectrum)).thenReturn(report(AnalysisMode.STRICT));
    when(strict.analyze(other)).thenReturn(report(AnalysisMode.STRICT));
    CachingSpectrumAnalyzer cache = cache(1);

    cache.analyze(spectrum, AnalysisMode.STRICT);
    cache.analyze(other, AnalysisMode.STRICT);
    assertEquals(1, cache.size());

    cache.analyze(spectrum, AnalysisMode.STRICT);
    verify(strict, times(2)).analyze(spectrum);

    cache.invalidateAll();
    assertEquals(0, cache.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnconfiguredMode() throws Exception {
    Map<AnalysisMode, SpectrumAnalyzer> analyzers = new EnumMap<>(AnalysisMode.class);
    analyzers.put(AnalysisMode.STRICT, strict);
    new CachingSpectrumAnalyzer(analyzers, 4).analyze(spectrum, AnalysisMode.ROBUST);
  }
}
