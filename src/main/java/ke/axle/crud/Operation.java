package ke.axle.crud;

/**
 * How {@link GenericRecordService#addToSession} prepares the items it stages.
 */
public enum Operation {
    /**
     * Items are creation inputs, converted with {@code prepareForCreate}.
     */
    CREATE,
    /**
     * Items are (model, update input) pairs, applied with {@code applyChangesToItem}.
     */
    UPDATE
}
