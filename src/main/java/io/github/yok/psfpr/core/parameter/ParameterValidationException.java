package io.github.yok.psfpr.core.parameter;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Value;

/**
 * パラメータまたは PSF データの検証に失敗したことを表す例外です。
 *
 * <p>
 * 不足・不正だったフィールドを {@link Violation} の一覧として保持します。 この例外が発生した場合、位相回復は開始されません。
 * </p>
 */
@Getter
public class ParameterValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 検出した違反の一覧です。
     */
    private final transient List<Violation> violations;

    /**
     * 例外を生成します。
     *
     * @param violations 違反一覧です（空不可）
     */
    public ParameterValidationException(List<Violation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * 違反したフィールド名の一覧を返します。
     *
     * @return フィールド名の一覧です
     */
    public List<String> fields() {
        return violations.stream().map(Violation::getField).collect(Collectors.toList());
    }

    private static String buildMessage(List<Violation> violations) {
        return "PSF / 位相回復パラメータが不正です: " + violations.stream()
                .map(v -> v.getField() + "（" + v.getMessage() + "）")
                .collect(Collectors.joining(", "));
    }

    /**
     * 1 件の違反です。
     */
    @Value
    public static class Violation {

        /**
         * 違反したフィールド名です（例: {@code wl}, {@code psf_data}）。
         */
        String field;

        /**
         * 違反内容です。
         */
        String message;
    }
}
