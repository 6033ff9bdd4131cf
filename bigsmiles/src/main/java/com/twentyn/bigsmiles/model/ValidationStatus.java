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

package com.twentyn.bigsmiles.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidationStatus {
  public enum State {
    UNVALIDATED,
    VALID,
    VALID_WITH_WARNINGS,
  }

  private State state = State.UNVALIDATED;
  private final List<DescriptorMismatchWarning> warnings = new ArrayList<>();

  public State getState() {
    return state;
  }

  public boolean isValidated() {
    return state != State.UNVALIDATED;
  }

  public List<DescriptorMismatchWarning> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  public void addWarning(DescriptorMismatchWarning warning) {
    if (isValidated()) {
      throw new IllegalStateException("Cannot add warnings after validation");
    }
    warnings.add(warning);
  }

  public void markValidated() {
    if (isValidated()) {
      throw new IllegalStateException("Graph has already been validated");
    }
    state = warnings.isEmpty() ? State.VALID : State.VALID_WITH_WARNINGS;
  }
}
