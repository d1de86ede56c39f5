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
package com.microsoft.azure.vmprovision.util;

import com.azure.resourcemanager.storage.models.SkuName;
import com.microsoft.azure.vmprovision.AzureTagPair;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class AzureUtil {

    private static final String STORAGE_ACCOUNT_NAME_PATTERN = "^[a-z0-9]+$";

    private static final String NON_ALPHANUMERIC_PATTERN = "[^A-Za-z0-9]";

    public static final int STORAGE_ACCOUNT_MIN_LENGTH = 3;
    public static final int STORAGE_ACCOUNT_MAX_LENGTH = 24;

    /**
     * Validates storage account name.
     */
    public static boolean validateStorageAccountName(String storageAccountName) {
        if (storageAccountName.length() < STORAGE_ACCOUNT_MIN_LENGTH
                || storageAccountName.length() > STORAGE_ACCOUNT_MAX_LENGTH) {
            return false;
        }
        if (!storageAccountName.matches(STORAGE_ACCOUNT_NAME_PATTERN)) {
            return false;
        }
        return true;
    }

    /**
     * Returns the first {@code maxLength} characters of the value, or the value itself when shorter.
     * A null value is treated as empty.
     */
    public static String getTruncatedStr(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    /**
     * Drops every character that is not an ASCII letter or digit.
     */
    public static String stripNonAlphanumeric(String value) {
        return value.replaceAll(NON_ALPHANUMERIC_PATTERN, "");
    }

    /**
     * Extracts the storage account name out of a blob URI such as
     * {@code https://myaccount.blob.core.windows.net/vhds/os.vhd}.
     *
     * @param uri blob URI
     * @return the account name, or null when the URI cannot be parsed or has no dotted host
     */
    public static String getStorageAccountNameFromUri(String uri) {
        if (StringUtils.isBlank(uri)) {
            return null;
        }

        String host;
        try {
            host = new URI(uri.trim()).getHost();
        } catch (URISyntaxException e) {
            return null;
        }

        if (StringUtils.isEmpty(host)) {
            return null;
        }
        int index = host.indexOf('.');
        if (index <= 0) {
            return null;
        }
        return host.substring(0, index);
    }

    /**
     * Premium accounts do not support boot diagnostics blobs.
     */
    public static boolean isPremium(SkuName skuName) {
        return skuName != null
                && StringUtils.startsWithIgnoreCase(skuName.toString(), Constants.PREMIUM_SKU_PREFIX);
    }

    /**
     * Converts tag pairs into a map, later pairs overriding earlier ones with the same name.
     */
    public static Map<String, String> toTagMap(List<AzureTagPair> tags) {
        Map<String, String> result = new LinkedHashMap<>();
        if (tags == null) {
            return result;
        }
        for (AzureTagPair tag : tags) {
            if (tag != null && StringUtils.isNotBlank(tag.getName())) {
                result.put(tag.getName(), tag.getValue());
            }
        }
        return result;
    }

    public static String getLocationNameByLabel(String label) {
        return label.toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private AzureUtil() {
        // hide constructor
    }
}
