package rmdp;

public final class RobustState extends AbstractState<RobustAction> {
  public RobustState() {
    super(RobustAction::new);
  }
}
