/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync;

import com.impactupgrade.donorsync.controller.DonorImportController;
import com.impactupgrade.donorsync.environment.EnvironmentFactory;
import com.impactupgrade.donorsync.security.SecurityExceptionMapper;
import com.impactupgrade.donorsync.security.SecurityUtil;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.servlets.CrossOriginFilter;
import org.glassfish.jersey.media.multipart.MultiPartFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.servlet.ServletContainer;

import javax.servlet.DispatcherType;
import java.util.EnumSet;

public class App {

  // $PORT env var provided by Heroku
  private static final int PORT = Integer.parseInt(System.getenv("PORT") != null ? System.getenv("PORT") : "9009");

  protected final EnvironmentFactory envFactory;

  public App() {
    this.envFactory = new EnvironmentFactory();
  }

  public App(EnvironmentFactory envFactory) {
    this.envFactory = envFactory;
  }

  private Server server = null;

  public void start() throws Exception {
    server = new Server();

    final ServerConnector httpConnector = new ServerConnector(server);
    httpConnector.setPort(PORT);
    // large exports plus a slow spreadsheet API can take a few minutes end to end
    httpConnector.setIdleTimeout(5 * 60 * 1000);
    server.addConnector(httpConnector);

    ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
    context.setContextPath("/");

    // CORS
    FilterHolder cors = context.addFilter(CrossOriginFilter.class, "/*", EnumSet.of(DispatcherType.REQUEST));
    cors.setInitParameter(CrossOriginFilter.ALLOWED_ORIGINS_PARAM, "*");
    cors.setInitParameter(CrossOriginFilter.ACCESS_CONTROL_ALLOW_ORIGIN_HEADER, "*");
    cors.setInitParameter(CrossOriginFilter.ALLOWED_METHODS_PARAM, "GET,POST,OPTIONS,HEAD");
    cors.setInitParameter(CrossOriginFilter.ALLOWED_HEADERS_PARAM,
        "Accept,Authorization,Content-Type," + SecurityUtil.API_KEY_HEADER + ",Origin,X-Requested-With");

    // API/REST (Jersey)
    ResourceConfig apiConfig = new ResourceConfig();
    apiConfig.register(new SecurityExceptionMapper());
    apiConfig.register(MultiPartFeature.class);

    apiConfig.register(donorImportController());

    registerAPIControllers(apiConfig);

    context.addServlet(new ServletHolder(new ServletContainer(apiConfig)), "/api/*");

    server.setHandler(context);
    server.start();
  }

  public void stop() throws Exception {
    server.stop();
  }

  /**
   * Allow deployments to add custom Controllers, etc.
   */
  public void registerAPIControllers(ResourceConfig apiConfig) throws Exception {}

  // Allow deployments to override specific controllers.
  protected DonorImportController donorImportController() { return new DonorImportController(envFactory); }

  public EnvironmentFactory getEnvironmentFactory() {
    return envFactory;
  }

  /**
   * Runs locally on port 9009 (or $PORT). Copy environment-default.json's relevant sections to
   * resources/environment-local.json and fill in the api key and registry settings.
   */
  public static void main(String[] args) throws Exception {
    new App(new EnvironmentFactory("environment-local.json")).start();
  }
}
