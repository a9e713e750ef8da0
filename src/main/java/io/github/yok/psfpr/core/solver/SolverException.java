package io.github.yok.psfpr.core.solver;

/**
 * ソルバの計算に失敗したことを表す例外です。
 */
public class SolverException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
