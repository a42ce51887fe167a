package org.tanzu.pvemcp.batch;

import java.util.Objects;

/**
 * One action with its parameters, applied to every target of a dispatch.
 */
public final class ActionRequest {

    public static final String DEFAULT_BACKUP_MODE = "snapshot";
    public static final String DEFAULT_COMPRESS = "zstd";

    private final BatchAction action;
    private final String command;
    private final String storage;
    private final String mode;
    private final String compress;
    private final String notes;

    public ActionRequest(BatchAction action, String command, String storage, String mode, String compress, String notes) {
        this.action = Objects.requireNonNull(action, "action");
        this.command = command;
        this.storage = storage;
        this.mode = mode == null || mode.isBlank() ? DEFAULT_BACKUP_MODE : mode;
        this.compress = compress == null || compress.isBlank() ? DEFAULT_COMPRESS : compress;
        this.notes = notes;
    }

    public static ActionRequest of(BatchAction action) {
        return new ActionRequest(action, null, null, null, null, null);
    }

    public static ActionRequest shell(String command) {
        return new ActionRequest(BatchAction.SHELL, command, null, null, null, null);
    }

    public static ActionRequest backup(String storage) {
        return new ActionRequest(BatchAction.BACKUP, null, storage, null, null, null);
    }

    public BatchAction getAction() { return action; }
    public String getCommand() { return command; }
    public String getStorage() { return storage; }
    public String getMode() { return mode; }
    public String getCompress() { return compress; }
    public String getNotes() { return notes; }

    @Override
    public String toString() {
        return "ActionRequest{action=" + action +
               (command != null ? ", command='" + command + "'" : "") +
               (storage != null ? ", storage='" + storage + "', mode=" + mode + ", compress=" + compress : "") + "}";
    }
}
