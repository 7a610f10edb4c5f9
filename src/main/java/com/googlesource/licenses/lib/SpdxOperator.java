// Copyright (C) 2019 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.licenses.lib;

/** Operators combining license expressions. */
public enum SpdxOperator {
  OR(0),
  AND(1),
  WITH(2);

  /**
   * An operator with a larger priority binds stronger than an operator with a lower priority.
   * Operators of equal priority associate to the left.
   */
  public final int priority;

  SpdxOperator(int priority) {
    this.priority = priority;
  }

  /** Returns true when a {@code child} operand needs parentheses under this operator. */
  boolean bindsTighterThan(SpdxOperator child) {
    return priority > child.priority;
  }
}
