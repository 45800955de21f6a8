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

import com.nuclideid.isotopes.LibraryTier;

/**
 * The threshold profiles an analysis can run under.
 */
public enum AnalysisMode {
  STRICT(20.0, 30.0, 30.0, 5, LibraryTier.COMMON), // Live acquisition, where false positives are costly.
  ROBUST(30.0, 20.0, 20.0, null, LibraryTier.EXTENDED), // Uploaded or loosely calibrated files.
  ;

  private final double toleranceKeV;
  private final double isotopeFloor;
  private final double chainMemberFloor;
  private final Integer resultCap;
  private final LibraryTier libraryTier;

  AnalysisMode(double toleranceKeV, double isotopeFloor, double chainMemberFloor, Integer resultCap,
               LibraryTier libraryTier) {
    this.toleranceKeV = toleranceKeV;
    this.isotopeFloor = isotopeFloor;
    this.chainMemberFloor = chainMemberFloor;
    this.resultCap = resultCap;
    this.libraryTier = libraryTier;
  }

  /**
   * @return A new, independently modifiable profile holding this mode's defaults.
   */
  public AnalysisProfile defaultProfile() {
    return new AnalysisProfile(this, toleranceKeV, isotopeFloor, chainMemberFloor, resultCap, libraryTier);
  }
}
