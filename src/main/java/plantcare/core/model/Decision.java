package plantcare.core.model;

public enum Decision {
    ADMIT,
    REJECT
}
