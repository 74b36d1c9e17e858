package org.devops.customers.rest;

public final class ApiConstants {
  public static final class ApiPath {
    public static final String ROOT = "/";
    public static final String HEALTH = "/health";
    public static final String CUSTOMERS = "/customers";
    public static final String ID_PATH_VAR = "/{id}";
    public static final String SUSPEND = "/suspend";

    private ApiPath() {}
  }

  public static final class QueryParam {
    public static final String NAME = "name";
    public static final String ADDRESS = "address";
    public static final String EMAIL = "email";
    public static final String PHONE_NUMBER = "phone_number";
    public static final String MEMBER_SINCE = "member_since";
    public static final String STATUS = "status";

    private QueryParam() {}
  }

  private ApiConstants() {}
}
