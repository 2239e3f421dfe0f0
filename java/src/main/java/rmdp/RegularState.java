package rmdp;

public final class RegularState extends AbstractState<RegularAction> {
  public RegularState() {
    super(RegularAction::new);
  }
}
