/*
 * Copyright 2026 The identitygate Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.identitygate.auth.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

/**
 * Immutable settings for identity resolution.
 *
 * <p>Instances are created with {@link #newBuilder()} or read from the process environment with
 * {@link #fromEnvironment(Environment)}. Only the settings of the enabled {@link AuthMethod}s are
 * required.
 */
public final class AuthConfig {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final String AUTH_METHOD = "AUTH_METHOD";
  @VisibleForTesting static final String LOCAL_SECRET = "AUTH_LOCAL_SECRET";
  @VisibleForTesting static final String LOCAL_ALGORITHM = "AUTH_LOCAL_ALGORITHM";
  @VisibleForTesting static final String REMOTE_AUTHORITY = "AUTH_REMOTE_AUTHORITY";
  @VisibleForTesting static final String REMOTE_TENANT_ID = "AUTH_REMOTE_TENANT_ID";
  @VisibleForTesting static final String REMOTE_AUDIENCE = "AUTH_REMOTE_AUDIENCE";
  @VisibleForTesting static final String REMOTE_CLIENT_ID = "AUTH_REMOTE_CLIENT_ID";
  @VisibleForTesting static final String REMOTE_JWKS_URI = "AUTH_REMOTE_JWKS_URI";
  @VisibleForTesting static final String REMOTE_ISSUERS = "AUTH_REMOTE_ISSUERS";
  @VisibleForTesting static final String REMOTE_SUBJECT_CLAIM = "AUTH_REMOTE_SUBJECT_CLAIM";
  @VisibleForTesting static final String KEY_SET_TTL_SECONDS = "AUTH_KEY_SET_TTL_SECONDS";
  @VisibleForTesting static final String USER_CACHE_TTL_SECONDS = "AUTH_USER_CACHE_TTL_SECONDS";
  @VisibleForTesting static final String USER_CACHE_MAX_SIZE = "AUTH_USER_CACHE_MAX_SIZE";
  @VisibleForTesting
  static final String USER_CACHE_REFRESH_THRESHOLD = "AUTH_USER_CACHE_REFRESH_THRESHOLD";
  @VisibleForTesting
  static final String USER_CACHE_CLEANUP_SECONDS = "AUTH_USER_CACHE_CLEANUP_SECONDS";
  @VisibleForTesting static final String RESULT_CACHE_TTL_SECONDS = "AUTH_RESULT_CACHE_TTL_SECONDS";
  @VisibleForTesting static final String RESULT_CACHE_MAX_SIZE = "AUTH_RESULT_CACHE_MAX_SIZE";

  public static final String DEFAULT_LOCAL_ALGORITHM = "HS256";
  public static final String DEFAULT_SUBJECT_CLAIM = "oid";
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;
  public static final int DEFAULT_READ_TIMEOUT_MILLIS = 10000;
  public static final int DEFAULT_HTTP_RETRIES = 3;
  public static final long DEFAULT_PROVISIONING_GRACE_MILLIS = 5000;
  public static final int DEFAULT_BACKGROUND_THREADS = 4;
  public static final long DEFAULT_USER_CACHE_CLEANUP_MILLIS = TimeUnit.MINUTES.toMillis(5);

  private final AuthMethod authMethod;
  @Nullable private final String localSecret;
  private final String localAlgorithm;
  @Nullable private final String remoteAuthority;
  @Nullable private final String remoteTenantId;
  @Nullable private final String remoteAudience;
  @Nullable private final String remoteClientId;
  @Nullable private final String remoteJwksUri;
  private final ImmutableList<String> remoteIssuers;
  private final String remoteSubjectClaim;
  private final CacheOptions keySetOptions;
  private final CacheOptions userRecordOptions;
  private final CacheOptions authResultOptions;
  private final int connectTimeoutMillis;
  private final int readTimeoutMillis;
  private final int httpRetries;
  private final long provisioningGraceMillis;
  private final int backgroundThreads;
  private final long userCacheCleanupMillis;

  private AuthConfig(Builder builder) {
    this.authMethod = builder.authMethod;
    this.localSecret = builder.localSecret;
    this.localAlgorithm = builder.localAlgorithm;
    this.remoteAuthority = builder.remoteAuthority;
    this.remoteTenantId = builder.remoteTenantId;
    this.remoteAudience = builder.remoteAudience;
    this.remoteClientId = builder.remoteClientId;
    this.remoteJwksUri = builder.remoteJwksUri;
    this.remoteIssuers = ImmutableList.copyOf(builder.remoteIssuers);
    this.remoteSubjectClaim = builder.remoteSubjectClaim;
    this.keySetOptions = builder.keySetOptions;
    this.userRecordOptions = builder.userRecordOptions;
    this.authResultOptions = builder.authResultOptions;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
    this.readTimeoutMillis = builder.readTimeoutMillis;
    this.httpRetries = builder.httpRetries;
    this.provisioningGraceMillis = builder.provisioningGraceMillis;
    this.backgroundThreads = builder.backgroundThreads;
    this.userCacheCleanupMillis = builder.userCacheCleanupMillis;
  }

  public AuthMethod getAuthMethod() {
    return authMethod;
  }

  @Nullable
  public String getLocalSecret() {
    return localSecret;
  }

  public String getLocalAlgorithm() {
    return localAlgorithm;
  }

  @Nullable
  public String getRemoteAuthority() {
    return remoteAuthority;
  }

  @Nullable
  public String getRemoteTenantId() {
    return remoteTenantId;
  }

  @Nullable
  public String getRemoteAudience() {
    return remoteAudience;
  }

  @Nullable
  public String getRemoteClientId() {
    return remoteClientId;
  }

  /**
   * @return the configured key set URI; when absent the URI is found through OpenID discovery
   *         against the authority
   */
  public Optional<String> getRemoteJwksUri() {
    return Optional.fromNullable(remoteJwksUri);
  }

  /**
   * Returns the issuers accepted on remote tokens. When none were configured, the equivalent
   * issuer strings the provider uses for one tenant are derived from the authority and the tenant
   * id.
   */
  public ImmutableList<String> getRemoteIssuers() {
    if (!remoteIssuers.isEmpty() || !authMethod.isRemoteEnabled()) {
      return remoteIssuers;
    }
    String authority = stripTrailingSlash(remoteAuthority);
    return ImmutableList.of(
        authority + "/v2.0",
        "https://sts.windows.net/" + remoteTenantId + "/",
        "https://login.microsoftonline.com/" + remoteTenantId + "/v2.0");
  }

  /**
   * @return the audiences accepted on remote tokens: the configured audience and the client id
   */
  public ImmutableList<String> getRemoteAudiences() {
    ImmutableList.Builder<String> audiences = ImmutableList.builder();
    if (!Strings.isNullOrEmpty(remoteAudience)) {
      audiences.add(remoteAudience);
    }
    if (!Strings.isNullOrEmpty(remoteClientId) && !remoteClientId.equals(remoteAudience)) {
      audiences.add(remoteClientId);
    }
    return audiences.build();
  }

  public String getRemoteSubjectClaim() {
    return remoteSubjectClaim;
  }

  public CacheOptions getKeySetOptions() {
    return keySetOptions;
  }

  public CacheOptions getUserRecordOptions() {
    return userRecordOptions;
  }

  public CacheOptions getAuthResultOptions() {
    return authResultOptions;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  public int getReadTimeoutMillis() {
    return readTimeoutMillis;
  }

  public int getHttpRetries() {
    return httpRetries;
  }

  public long getProvisioningGraceMillis() {
    return provisioningGraceMillis;
  }

  public int getBackgroundThreads() {
    return backgroundThreads;
  }

  /**
   * @return the delay between two sweeps of expired user records
   */
  public long getUserCacheCleanupMillis() {
    return userCacheCleanupMillis;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("authMethod", authMethod)
        .add("localAlgorithm", localAlgorithm)
        .add("remoteAuthority", remoteAuthority)
        .add("remoteTenantId", remoteTenantId)
        .add("remoteAudiences", getRemoteAudiences())
        .add("remoteJwksUri", remoteJwksUri)
        .add("keySetOptions", keySetOptions)
        .add("userRecordOptions", userRecordOptions)
        .add("userCacheCleanupMillis", userCacheCleanupMillis)
        .add("authResultOptions", authResultOptions)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Reads the configuration from environment variables.
   *
   * @throws IllegalArgumentException if a variable required by an enabled method is missing, or
   *         a numeric variable cannot be parsed. The message names every missing variable.
   */
  public static AuthConfig fromEnvironment(Environment environment) {
    Preconditions.checkNotNull(environment);

    Builder builder = newBuilder();
    String rawMethod = environment.getVariable(AUTH_METHOD);
    if (!Strings.isNullOrEmpty(rawMethod)) {
      Optional<AuthMethod> method = AuthMethod.parse(rawMethod);
      if (method.isPresent()) {
        builder.setAuthMethod(method.get());
      } else {
        logger.atWarning().log("Invalid %s '%s', defaulting to 'both'", AUTH_METHOD, rawMethod);
      }
    }
    AuthMethod authMethod = builder.authMethod;

    List<String> missing = new ArrayList<>();
    if (authMethod.isLocalEnabled()) {
      builder.setLocalSecret(required(environment, LOCAL_SECRET, missing));
      String algorithm = environment.getVariable(LOCAL_ALGORITHM);
      if (!Strings.isNullOrEmpty(algorithm)) {
        builder.setLocalAlgorithm(algorithm);
      }
    }
    if (authMethod.isRemoteEnabled()) {
      builder.setRemoteClientId(required(environment, REMOTE_CLIENT_ID, missing));
      builder.setRemoteTenantId(required(environment, REMOTE_TENANT_ID, missing));
      builder.setRemoteAuthority(required(environment, REMOTE_AUTHORITY, missing));
      builder.setRemoteAudience(required(environment, REMOTE_AUDIENCE, missing));
      builder.setRemoteJwksUri(Strings.emptyToNull(environment.getVariable(REMOTE_JWKS_URI)));
      String issuers = environment.getVariable(REMOTE_ISSUERS);
      if (!Strings.isNullOrEmpty(issuers)) {
        builder.setRemoteIssuers(
            Splitter.on(',').trimResults().omitEmptyStrings().splitToList(issuers));
      }
      String subjectClaim = environment.getVariable(REMOTE_SUBJECT_CLAIM);
      if (!Strings.isNullOrEmpty(subjectClaim)) {
        builder.setRemoteSubjectClaim(subjectClaim.trim());
      }
    }
    if (!missing.isEmpty()) {
      String message = String.format("Authentication configuration errors: %s",
          Joiner.on("; ").join(missing));
      logger.atSevere().log("%s", message);
      throw new IllegalArgumentException(message);
    }

    CacheOptions userDefaults = CacheOptions.userRecordDefaults();
    builder.setKeySetOptions(new CacheOptions(1,
        secondsVariable(environment, KEY_SET_TTL_SECONDS, CacheOptions.DEFAULT_KEY_SET_TTL_MILLIS),
        1.0));
    builder.setUserRecordOptions(new CacheOptions(
        intVariable(environment, USER_CACHE_MAX_SIZE, userDefaults.getNumEntries()),
        secondsVariable(environment, USER_CACHE_TTL_SECONDS, userDefaults.getTtlMillis()),
        doubleVariable(environment, USER_CACHE_REFRESH_THRESHOLD,
            userDefaults.getRefreshThreshold())));
    builder.setUserCacheCleanupMillis(secondsVariable(environment, USER_CACHE_CLEANUP_SECONDS,
        DEFAULT_USER_CACHE_CLEANUP_MILLIS));
    builder.setAuthResultOptions(new CacheOptions(
        intVariable(environment, RESULT_CACHE_MAX_SIZE,
            CacheOptions.DEFAULT_AUTH_RESULT_NUM_ENTRIES),
        secondsVariable(environment, RESULT_CACHE_TTL_SECONDS,
            CacheOptions.DEFAULT_AUTH_RESULT_TTL_MILLIS),
        1.0));

    AuthConfig config = builder.build();
    logger.atInfo().log("Authentication method configured: %s", config.getAuthMethod());
    return config;
  }

  @Nullable
  private static String required(Environment environment, String name, List<String> missing) {
    String value = environment.getVariable(name);
    if (Strings.isNullOrEmpty(value)) {
      missing.add(String.format("Environment variable '%s' is not set", name));
      return null;
    }
    return value;
  }

  private static long secondsVariable(Environment environment, String name, long defaultMillis) {
    String value = environment.getVariable(name);
    if (Strings.isNullOrEmpty(value)) {
      return defaultMillis;
    }
    return TimeUnit.SECONDS.toMillis(parseNumber(name, value).longValue());
  }

  private static int intVariable(Environment environment, String name, int defaultValue) {
    String value = environment.getVariable(name);
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    return parseNumber(name, value).intValue();
  }

  private static double doubleVariable(Environment environment, String name, double defaultValue) {
    String value = environment.getVariable(name);
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    return parseNumber(name, value).doubleValue();
  }

  private static Number parseNumber(String name, String value) {
    try {
      return Double.valueOf(value.trim());
    } catch (NumberFormatException exception) {
      throw new IllegalArgumentException(
          String.format("Environment variable '%s' is not a number: %s", name, value), exception);
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /**
   * Builder for {@link AuthConfig}.
   */
  public static final class Builder {
    private AuthMethod authMethod = AuthMethod.BOTH;
    private String localSecret;
    private String localAlgorithm = DEFAULT_LOCAL_ALGORITHM;
    private String remoteAuthority;
    private String remoteTenantId;
    private String remoteAudience;
    private String remoteClientId;
    private String remoteJwksUri;
    private List<String> remoteIssuers = ImmutableList.of();
    private String remoteSubjectClaim = DEFAULT_SUBJECT_CLAIM;
    private CacheOptions keySetOptions = CacheOptions.keySetDefaults();
    private CacheOptions userRecordOptions = CacheOptions.userRecordDefaults();
    private CacheOptions authResultOptions = CacheOptions.authResultDefaults();
    private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
    private int readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;
    private int httpRetries = DEFAULT_HTTP_RETRIES;
    private long provisioningGraceMillis = DEFAULT_PROVISIONING_GRACE_MILLIS;
    private int backgroundThreads = DEFAULT_BACKGROUND_THREADS;
    private long userCacheCleanupMillis = DEFAULT_USER_CACHE_CLEANUP_MILLIS;

    private Builder() {}

    public Builder setAuthMethod(AuthMethod authMethod) {
      this.authMethod = Preconditions.checkNotNull(authMethod);
      return this;
    }

    public Builder setLocalSecret(String localSecret) {
      this.localSecret = localSecret;
      return this;
    }

    public Builder setLocalAlgorithm(String localAlgorithm) {
      this.localAlgorithm = Preconditions.checkNotNull(localAlgorithm);
      return this;
    }

    public Builder setRemoteAuthority(String remoteAuthority) {
      this.remoteAuthority = remoteAuthority;
      return this;
    }

    public Builder setRemoteTenantId(String remoteTenantId) {
      this.remoteTenantId = remoteTenantId;
      return this;
    }

    public Builder setRemoteAudience(String remoteAudience) {
      this.remoteAudience = remoteAudience;
      return this;
    }

    public Builder setRemoteClientId(String remoteClientId) {
      this.remoteClientId = remoteClientId;
      return this;
    }

    public Builder setRemoteJwksUri(String remoteJwksUri) {
      this.remoteJwksUri = remoteJwksUri;
      return this;
    }

    public Builder setRemoteIssuers(List<String> remoteIssuers) {
      this.remoteIssuers = Preconditions.checkNotNull(remoteIssuers);
      return this;
    }

    public Builder setRemoteSubjectClaim(String remoteSubjectClaim) {
      this.remoteSubjectClaim = Preconditions.checkNotNull(remoteSubjectClaim);
      return this;
    }

    public Builder setKeySetOptions(CacheOptions keySetOptions) {
      this.keySetOptions = Preconditions.checkNotNull(keySetOptions);
      return this;
    }

    public Builder setUserRecordOptions(CacheOptions userRecordOptions) {
      this.userRecordOptions = Preconditions.checkNotNull(userRecordOptions);
      return this;
    }

    public Builder setAuthResultOptions(CacheOptions authResultOptions) {
      this.authResultOptions = Preconditions.checkNotNull(authResultOptions);
      return this;
    }

    public Builder setConnectTimeoutMillis(int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
      return this;
    }

    public Builder setReadTimeoutMillis(int readTimeoutMillis) {
      this.readTimeoutMillis = readTimeoutMillis;
      return this;
    }

    public Builder setHttpRetries(int httpRetries) {
      this.httpRetries = httpRetries;
      return this;
    }

    public Builder setProvisioningGraceMillis(long provisioningGraceMillis) {
      this.provisioningGraceMillis = provisioningGraceMillis;
      return this;
    }

    public Builder setBackgroundThreads(int backgroundThreads) {
      this.backgroundThreads = backgroundThreads;
      return this;
    }

    public Builder setUserCacheCleanupMillis(long userCacheCleanupMillis) {
      this.userCacheCleanupMillis = userCacheCleanupMillis;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a setting required by the chosen method is missing
     */
    public AuthConfig build() {
      if (authMethod.isLocalEnabled()) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(localSecret),
            "a local secret is required for local authentication");
      }
      if (authMethod.isRemoteEnabled()) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(remoteClientId),
            "a client id is required for remote authentication");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(remoteTenantId),
            "a tenant id is required for remote authentication");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(remoteAuthority),
            "an authority is required for remote authentication");
      }
      Preconditions.checkArgument(connectTimeoutMillis > 0 && readTimeoutMillis > 0,
          "HTTP timeouts must be positive");
      Preconditions.checkArgument(httpRetries >= 0, "httpRetries must not be negative");
      Preconditions.checkArgument(backgroundThreads > 0, "backgroundThreads must be positive");
      Preconditions.checkArgument(userCacheCleanupMillis > 0,
          "userCacheCleanupMillis must be positive");
      return new AuthConfig(this);
    }
  }
}
