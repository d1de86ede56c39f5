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

public class ProvisioningResult {

    private final ComputeLongRunningOperation operation;

    private final List<String> notices;

    public ProvisioningResult(ComputeLongRunningOperation operation, List<String> notices) {
        this.operation = operation;
        this.notices = Collections.unmodifiableList(new ArrayList<>(notices));
    }

    public ComputeLongRunningOperation getOperation() {
        return operation;
    }

    /**
     * @return warnings about boot diagnostics or the BGInfo extension, in the order they were raised
     */
    public List<String> getNotices() {
        return notices;
    }
}
