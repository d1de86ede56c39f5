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

import com.microsoft.azure.vmprovision.client.ComputeClient;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.util.AzureUtil;
import com.microsoft.azure.vmprovision.util.Constants;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks the newest published version of the BGInfo extension at a location.
 */
public class BGInfoExtensionVersionSelector {

    private static final Logger LOGGER = Logger.getLogger(BGInfoExtensionVersionSelector.class.getName());

    private static final int MIN_VERSION_PARTS = 2;

    private static final int MAX_VERSION_PARTS = 4;

    private final ComputeClient computeClient;

    private final String publisher;

    private final String extensionName;

    private final String defaultVersion;

    public BGInfoExtensionVersionSelector(
            ComputeClient computeClient, String publisher, String extensionName, String defaultVersion) {
        this.computeClient = computeClient;
        this.publisher = publisher;
        this.extensionName = extensionName;
        this.defaultVersion = defaultVersion;
    }

    public BGInfoExtensionVersionSelector(ComputeClient computeClient) {
        this(computeClient, Constants.BGINFO_EXTENSION_PUBLISHER, Constants.BGINFO_EXTENSION_NAME,
                Constants.BGINFO_EXTENSION_DEFAULT_VERSION);
    }

    /**
     * @param location location label or name, canonicalized before use
     * @return the version as {@code major.minor}, absent when the publisher, the extension type or
     * any version is missing at the location
     */
    public Optional<String> selectVersion(String location) throws AzureCloudException {
        String canonicalizedLocation = AzureUtil.getLocationNameByLabel(location);

        List<String> publishers = computeClient.listPublishers(canonicalizedLocation);
        if (publishers == null || !publishers.contains(publisher)) {
            LOGGER.log(Level.INFO,
                    "BGInfoExtensionVersionSelector: selectVersion: publisher {0} not available at {1}",
                    new Object[]{publisher, canonicalizedLocation});
            return Optional.empty();
        }

        List<String> types = computeClient.listExtensionTypes(canonicalizedLocation, publisher);
        if (types == null || !types.contains(extensionName)) {
            LOGGER.log(Level.INFO,
                    "BGInfoExtensionVersionSelector: selectVersion: extension {0} not available at {1}",
                    new Object[]{extensionName, canonicalizedLocation});
            return Optional.empty();
        }

        List<String> versions = computeClient.listExtensionVersions(canonicalizedLocation, publisher, extensionName);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(selectNewest(versions));
    }

    /**
     * Returns the greatest parsable version as {@code major.minor}, or the default version when
     * none of the names parse.
     */
    String selectNewest(List<String> versions) {
        int[] newest = null;
        for (String name : versions) {
            int[] parsed = parseVersion(name);
            if (parsed != null && (newest == null || compare(parsed, newest) > 0)) {
                newest = parsed;
            }
        }
        if (newest == null) {
            LOGGER.log(Level.WARNING,
                    "BGInfoExtensionVersionSelector: selectNewest: no parsable version in {0}, using {1}",
                    new Object[]{versions, defaultVersion});
            return defaultVersion;
        }
        return newest[0] + "." + newest[1];
    }

    /**
     * Parses {@code major.minor[.build[.revision]]}.
     *
     * @return major and minor, or null when the name is not such a version
     */
    static int[] parseVersion(String name) {
        if (name == null) {
            return null;
        }
        String[] parts = name.trim().split("\\.", -1);
        if (parts.length < MIN_VERSION_PARTS || parts.length > MAX_VERSION_PARTS) {
            return null;
        }
        int[] numbers = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty() || !parts[i].chars().allMatch(Character::isDigit)) {
                return null;
            }
            try {
                numbers[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return new int[]{numbers[0], numbers[1]};
    }

    private static int compare(int[] left, int[] right) {
        int major = Integer.compare(left[0], right[0]);
        return major != 0 ? major : Integer.compare(left[1], right[1]);
    }
}
