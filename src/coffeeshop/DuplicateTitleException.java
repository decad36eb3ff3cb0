package coffeeshop;

public class DuplicateTitleException extends Exception {
    public DuplicateTitleException(String title) {
        super("A drink titled '" + title + "' already exists");
    }
}
