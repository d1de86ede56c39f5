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
package com.microsoft.azure.vmprovision.client;

import com.azure.resourcemanager.AzureResourceManager;
import com.azure.resourcemanager.resources.models.Subscription;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;

public class AzureSessionContext implements SessionContext {

    private final AzureResourceManager azureClient;

    private String subscriptionName;

    public AzureSessionContext(AzureResourceManager azureClient) {
        if (azureClient == null) {
            throw new NullPointerException("the azure client is null!");
        }
        this.azureClient = azureClient;
    }

    @Override
    public String getSubscriptionName() throws AzureCloudException {
        if (subscriptionName == null) {
            try {
                Subscription subscription = azureClient.getCurrentSubscription();
                subscriptionName = subscription.displayName();
            } catch (Exception e) {
                throw AzureCloudException.create("Failed to read the current subscription", e);
            }
        }
        return subscriptionName;
    }
}
