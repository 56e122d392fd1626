// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.storage.internal;

import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.ApiName;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Provides the ApiName attached to every AWS SDK request this library makes.
 */
public class ApiNameVersion {
    private static final ApiName API_NAME = ApiNameVersion.apiNameWithVersion();
    // Used in overrideConfiguration
    public static final Consumer<AwsRequestOverrideConfiguration.Builder> API_NAME_INTERCEPTOR =
            builder -> builder.addApiName(API_NAME);

    public static final String NAME = "AmazonStorageEncryptionTransform";
    public static final String API_VERSION_UNKNOWN = "1-unknown";

    private static final String ARTIFACT_ID = "amazon-storage-encryption-transform-java";
    private static final String VERSION_PROPERTY = "storageTransformVersion";

    private ApiNameVersion() {
    }

    public static ApiName apiNameWithVersion() {
        return ApiName.builder()
                .name(NAME)
                .version(apiVersion())
                .build();
    }

    static String apiVersion() {
        try {
            final Properties properties = new Properties();
            final ClassLoader loader = ApiNameVersion.class.getClassLoader();

            // Other JARs on the classpath may also define project.properties
            Enumeration<URL> urls = loader.getResources("project.properties");
            if (urls == null) {
                return API_VERSION_UNKNOWN;
            }
            while (urls.hasMoreElements()) {
                URL thisURL = urls.nextElement();
                if (thisURL.getPath().contains(ARTIFACT_ID)) {
                    try (InputStream in = thisURL.openStream()) {
                        properties.load(in);
                    }
                    break;
                }
            }
            String maybeVersion = properties.getProperty(VERSION_PROPERTY);
            if (maybeVersion == null) {
                return API_VERSION_UNKNOWN;
            }
            return maybeVersion;
        } catch (final IOException ex) {
            return API_VERSION_UNKNOWN;
        }
    }
}
