/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.security;

import com.google.common.base.Strings;
import com.impactupgrade.donorsync.environment.Environment;

/**
 * An API key must be sent by the portal and any other client, included as a header (or, for quick manual runs, a
 * query param). With no key configured, every call is rejected.
 */
public class SecurityUtil {

  public static final String API_KEY_HEADER = "DonorSync-Api-Key";

  public static void verifyApiKey(Environment env) throws SecurityException {
    // headers and query params both end up in the other context, case-insensitively
    String apiKey = env.getOtherContext().get(API_KEY_HEADER);
    String expectedApiKey = env.getConfig().apiKey;
    if (Strings.isNullOrEmpty(expectedApiKey) || !expectedApiKey.equals(apiKey)) {
      env.logJobWarn("unable to verify api key");
      throw new SecurityException();
    }
  }
}
