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
package com.microsoft.azure.vmprovision.exceptions;

import com.azure.core.management.exception.ManagementException;

public final class AzureCloudException extends Exception {

    private static final long serialVersionUID = -8157417759485046943L;

    private AzureCloudException(String msg) {
        super(msg);
    }

    private AzureCloudException(String msg, Exception ex) {
        super(msg, ex);
    }

    public static AzureCloudException create(Exception ex) {
        return create(null, ex);
    }

    public static AzureCloudException create(String msg) {
        return new AzureCloudException(msg);
    }

    public static AzureCloudException create(String msg, Exception ex) {
        if (ex instanceof ManagementException) {
            // Keep only the service error message. ManagementException carries the full HTTP
            // response, which is not serializable and is of no use to callers.
            String detail = describe((ManagementException) ex);
            if (msg != null) {
                return new AzureCloudException(String.format("%s: %s", msg, detail));
            } else {
                return new AzureCloudException(detail);
            }
        } else {
            return new AzureCloudException(msg, ex);
        }
    }

    private static String describe(ManagementException ex) {
        if (ex.getValue() != null && ex.getValue().getCode() != null) {
            return String.format("%s (%s)", ex.getMessage(), ex.getValue().getCode());
        }
        return ex.getMessage();
    }
}
