package til;

public enum EnvVar {
  TIL_UNRESOLVED_IDENTIFIERS(
      "Set to \"fail\" to reject identifiers that are not in scope "
          + "instead of passing them through."),
  TIL_DUMP_CFG("Set to \"1\" to log every normalized CFG."),
  TIL_VERIFY("Set to \"0\" to skip verification of normalized CFGs.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public boolean isSetToZero() {
    return isAvailable() && isSetToValue("0");
  }

  public boolean isSetToOne() {
    return isAvailable() && isSetToValue("1");
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equalsIgnoreCase(varValue);
  }

  private String getValue() {
    return System.getenv(this.name());
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(this.name());
  }
}
