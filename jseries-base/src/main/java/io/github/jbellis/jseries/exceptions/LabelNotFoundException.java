/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jseries.exceptions;

import java.util.NoSuchElementException;

/**
 * Thrown when a Series holds no entry with the requested label.
 */
public class LabelNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final transient Object label;

    /**
     * @param label the label that was looked up
     */
    public LabelNotFoundException(Object label) {
        super("no value found for label " + label);
        this.label = label;
    }

    /** @return the label that was looked up */
    public Object getLabel() {
        return label;
    }
}
