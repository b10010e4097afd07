package til.lower;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import til.EnvVar;
import til.ssa.SsaPass;

/** Knobs of {@link CfgReducer}. Instances are immutable; use {@link #builder()} to make one. */
public final class LoweringOptions {

  public static final LoweringOptions DEFAULT = builder().build();

  public final UnresolvedIdentifierPolicy unresolvedIdentifiers;
  /** Run {@link til.cfg.CfgVerifier} on every normalized CFG. */
  public final boolean verify;
  /** Log every normalized CFG at INFO level. */
  public final boolean dumpCfg;

  @Nullable private final SsaPass ssaPass;

  private LoweringOptions(Builder builder) {
    this.unresolvedIdentifiers = builder.unresolvedIdentifiers;
    this.verify = builder.verify;
    this.dumpCfg = builder.dumpCfg;
    this.ssaPass = builder.ssaPass;
  }

  public Optional<SsaPass> ssaPass() {
    return Optional.ofNullable(ssaPass);
  }

  /** Defaults, overridden by whatever {@link EnvVar}s are set. */
  public static LoweringOptions fromEnvironment() {
    return builder()
        .unresolvedIdentifiers(
            EnvVar.TIL_UNRESOLVED_IDENTIFIERS.isSetToValue("fail")
                ? UnresolvedIdentifierPolicy.FAIL
                : UnresolvedIdentifierPolicy.PASS_THROUGH)
        .verify(!EnvVar.TIL_VERIFY.isSetToZero())
        .dumpCfg(EnvVar.TIL_DUMP_CFG.isSetToOne())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .unresolvedIdentifiers(unresolvedIdentifiers)
        .verify(verify)
        .dumpCfg(dumpCfg)
        .ssaPass(ssaPass);
  }

  public static final class Builder {
    private UnresolvedIdentifierPolicy unresolvedIdentifiers =
        UnresolvedIdentifierPolicy.PASS_THROUGH;
    private boolean verify = true;
    private boolean dumpCfg = false;
    @Nullable private SsaPass ssaPass;

    private Builder() {}

    public Builder unresolvedIdentifiers(UnresolvedIdentifierPolicy policy) {
      this.unresolvedIdentifiers = policy;
      return this;
    }

    public Builder verify(boolean verify) {
      this.verify = verify;
      return this;
    }

    public Builder dumpCfg(boolean dumpCfg) {
      this.dumpCfg = dumpCfg;
      return this;
    }

    public Builder ssaPass(@Nullable SsaPass ssaPass) {
      this.ssaPass = ssaPass;
      return this;
    }

    public LoweringOptions build() {
      return new LoweringOptions(this);
    }
  }
}
