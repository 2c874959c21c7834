package dev.resumematcher.exception;

/**
 * Unknown job, resume or match id.
 */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String entity, Long id) {
        super(entity + " not found: " + id);
    }
}
