package ussim.domain;

import java.util.List;

public final class Issues {
  public static final String ECONOMY = "economy";
  public static final String HEALTHCARE = "healthcare";
  public static final String ENVIRONMENT = "environment";
  public static final String SECURITY = "security";
  public static final String EDUCATION = "education";

  public static final List<String> ALL = List.of(ECONOMY, EDUCATION, ENVIRONMENT, HEALTHCARE, SECURITY);

  private Issues() {}
}
