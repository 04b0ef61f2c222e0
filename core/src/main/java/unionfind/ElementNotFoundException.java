package unionfind;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation refers to an element outside the universe the structure was built with.
 */
public class ElementNotFoundException extends NoSuchElementException {
    private final transient Object element;

    public ElementNotFoundException(Object element) {
        super("element not found in universe: " + element);
        this.element = element;
    }

    public Object getElement() {
        return element;
    }
}
