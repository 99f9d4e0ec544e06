package in.smcdesk.domain.structure;

public enum SwingKind {
    HIGH,
    LOW
}
