/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package logstream.util;

/**
 * A supplier of a value whose computation may throw a checked exception, such as a file write
 * that must run on the fiber owning the file.
 *
 * @param <T> the type of the supplied value
 * @param <E> the type of exception the computation may throw
 */
@FunctionalInterface
public interface CheckedSupplier<T, E extends Throwable> {

  T get() throws E;
}
