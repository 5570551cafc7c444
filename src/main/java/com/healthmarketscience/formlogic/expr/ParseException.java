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

package com.healthmarketscience.formlogic.expr;

/**
 * Exception thrown when expression parsing fails.
 *
 * @author James Ahlborn
 */
public class ParseException extends IllegalArgumentException
{
  private static final long serialVersionUID = 20180826L;

  private final int _offset;

  public ParseException(String message, int offset) {
    super(message);
    _offset = offset;
  }

  public ParseException(String message, int offset, Throwable cause) {
    super(message, cause);
    _offset = offset;
  }

  /**
   * @return the character offset in the expression text where parsing
   *         failed
   */
  public int getOffset() {
    return _offset;
  }
}
