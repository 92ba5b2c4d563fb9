package pe.farmaciasperuanas.digital.process.clickstream.domain.exception;

public class UnknownViewException extends RuntimeException {

    private final String view;

    public UnknownViewException(String view) {
        super("Vista desconocida: " + view);
        this.view = view;
    }

    public String getView() {
        return view;
    }
}
