/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.environment;

import org.apache.http.client.utils.URLEncodedUtils;

import javax.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;

public class EnvironmentFactory {

  private String otherJsonFilename = null;

  public EnvironmentFactory() {
  }

  public EnvironmentFactory(String otherJsonFilename) {
    this.otherJsonFilename = otherJsonFilename;
  }

  public Environment init(HttpServletRequest request) {
    Environment env = newEnv();
    setRequest(env, request);

    env.getConfig().addOtherJsonFile(otherJsonFilename);

    return env;
  }

  public Environment init(String otherJsonFilename) {
    Environment env = newEnv();

    env.getConfig().addOtherJsonFile(this.otherJsonFilename);
    env.getConfig().addOtherJsonFile(otherJsonFilename);

    return env;
  }

  protected Environment newEnv() {
    return new Environment();
  }

  protected void setRequest(Environment env, HttpServletRequest request) {
    if (request != null) {
      Enumeration<String> headerNames = request.getHeaderNames();
      while (headerNames != null && headerNames.hasMoreElements()) {
        String headerName = headerNames.nextElement();
        env.getOtherContext().put(headerName, request.getHeader(headerName));
      }

      if (request.getQueryString() != null) {
        URLEncodedUtils.parse(request.getQueryString(), StandardCharsets.UTF_8).forEach(
            pair -> env.getOtherContext().put(pair.getName(), pair.getValue()));
      }

      env.getOtherContext().put("uri", request.getRequestURI());
    }
  }
}
