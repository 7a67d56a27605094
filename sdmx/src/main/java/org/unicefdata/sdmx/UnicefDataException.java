/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.unicefdata.sdmx;

/**
 * Base exception for the UNICEF data client.
 *
 * <p>All failures surfaced to callers of {@link UnicefDataClient} are
 * subclasses of this type, so a single catch clause handles every error the
 * pipeline can raise.
 */
public class UnicefDataException extends RuntimeException {

  /**
   * Creates a new UnicefDataException with the specified message.
   */
  public UnicefDataException(String message) {
    super(message);
  }

  /**
   * Creates a new UnicefDataException with the specified message and cause.
   */
  public UnicefDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
