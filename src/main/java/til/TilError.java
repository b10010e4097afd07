package til;

/** Basic error class in this project. */
public class TilError extends RuntimeException {

  public TilError(String message) {
    super(message);
  }
}
