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

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * User facing notices, read from {@code Messages.properties}.
 */
public final class Messages {

    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle(Constants.MESSAGES_BUNDLE);

    public static String storageAccountNotFoundForBootDiagnostics(String accountName) {
        return format("StorageAccountNotFoundForBootDiagnostics", accountName);
    }

    public static String errorDuringGettingStorageAccountForBootDiagnostics(String accountName, String error) {
        return format("ErrorDuringGettingStorageAccountForBootDiagnostics", accountName, error);
    }

    public static String usingExistingStorageAccountForBootDiagnostics(String accountName) {
        return format("UsingExistingStorageAccountForBootDiagnostics", accountName);
    }

    public static String creatingStorageAccountForBootDiagnostics(String accountName) {
        return format("CreatingStorageAccountForBootDiagnostics", accountName);
    }

    public static String errorDuringCreatingStorageAccountForBootDiagnostics(String error) {
        return format("ErrorDuringCreatingStorageAccountForBootDiagnostics", error);
    }

    public static String errorDuringInstallingBGInfoExtension(String vmName, String error) {
        return format("ErrorDuringInstallingBGInfoExtension", vmName, error);
    }

    private static String format(String key, Object... args) {
        return MessageFormat.format(BUNDLE.getString(key), args);
    }

    private Messages() {
    }
}
