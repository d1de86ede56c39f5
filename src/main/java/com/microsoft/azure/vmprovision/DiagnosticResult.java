/*
 Copyright 2016 Microsoft, Inc.

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
package com.microsoft.azure.vmprovision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A possibly absent value together with the non-fatal notices raised while computing it.
 *
 * @param <T> type of the value
 */
public final class DiagnosticResult<T> {

    private final T value;

    private final List<String> notices;

    private DiagnosticResult(T value, List<String> notices) {
        this.value = value;
        this.notices = Collections.unmodifiableList(new ArrayList<>(notices));
    }

    public static <T> DiagnosticResult<T> of(T value, List<String> notices) {
        return new DiagnosticResult<>(value, notices);
    }

    public static <T> DiagnosticResult<T> empty(List<String> notices) {
        return new DiagnosticResult<>(null, notices);
    }

    public static <T> DiagnosticResult<T> empty() {
        return new DiagnosticResult<>(null, Collections.<String>emptyList());
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public List<String> getNotices() {
        return notices;
    }
}
