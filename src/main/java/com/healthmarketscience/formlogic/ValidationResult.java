/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.formlogic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a validation, either the validated value or the issues found.
 * Any issue, including a warning, makes the result invalid.
 *
 * @author James Ahlborn
 */
public final class ValidationResult<T>
{
  private final T _value;
  private final List<ValidationIssue> _issues;

  private ValidationResult(T value, List<ValidationIssue> issues) {
    _value = value;
    _issues = issues;
  }

  public static <T> ValidationResult<T> valid(T value) {
    return new ValidationResult<T>(
        value, Collections.<ValidationIssue>emptyList());
  }

  public static <T> ValidationResult<T> of(
      T value, List<ValidationIssue> issues) {
    if(issues.isEmpty()) {
      return valid(value);
    }
    return new ValidationResult<T>(
        null, Collections.unmodifiableList(
            new ArrayList<ValidationIssue>(issues)));
  }

  public boolean isValid() {
    return _issues.isEmpty();
  }

  /**
   * @return the validated value, {@code null} if not {@link #isValid}
   */
  public T getValue() {
    return _value;
  }

  public List<ValidationIssue> getIssues() {
    return _issues;
  }

  /**
   * @return {@code true} if any issue has severity
   *         {@link ValidationIssue.Severity#ERROR}
   */
  public boolean hasErrors() {
    for(ValidationIssue issue : _issues) {
      if(issue.getSeverity() == ValidationIssue.Severity.ERROR) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return (isValid() ? "ValidationResult[valid]" :
            "ValidationResult" + _issues);
  }
}
