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

import java.time.OffsetDateTime;

/**
 * Outcome of a provisioning call against the compute service.
 */
public class ComputeLongRunningOperation {

    private final String operationId;

    private final String status;

    private final OffsetDateTime startTime;

    private final OffsetDateTime endTime;

    public ComputeLongRunningOperation(
            String operationId, String status, OffsetDateTime startTime, OffsetDateTime endTime) {
        this.operationId = operationId;
        this.status = status;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    /**
     * @return resource id of the provisioned virtual machine
     */
    public String getOperationId() {
        return operationId;
    }

    public String getStatus() {
        return status;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    @Override
    public String toString() {
        return "ComputeLongRunningOperation{operationId=" + operationId
                + ", status=" + status
                + ", startTime=" + startTime
                + ", endTime=" + endTime + "}";
    }
}
