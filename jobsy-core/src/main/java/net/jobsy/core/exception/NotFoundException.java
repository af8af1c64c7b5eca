package net.jobsy.core.exception;

public class NotFoundException extends JobsyException {

    private final Object id;

    public NotFoundException(String what, Object id) {
        super(what + " not found: " + id);
        this.id = id;
    }

    public Object getId() {
        return id;
    }
}
