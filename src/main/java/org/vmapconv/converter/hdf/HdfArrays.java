package org.vmapconv.converter.hdf;

import java.util.ArrayList;
import java.util.List;

/**
 * HDF 数据集数值的宽松转换：jHDF 读回的数组元素类型取决于文件里的存储宽度（int/long/short/byte/float/double），
 * 这里统一转换为转换器使用的 {@code int}/{@code double}/{@code String}。
 * <p>
 * 二维数据由 jHDF 以数组的数组返回（例如 {@code float[][]}），按行展开。
 */
final class HdfArrays {

    private HdfArrays() {
    }

    static int[] toIntArray(Object data, String where) {
        if (data instanceof int[] values) {
            return values;
        }
        if (data instanceof long[] values) {
            int[] result = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = (int) values[i];
            }
            return result;
        }
        if (data instanceof short[] values) {
            int[] result = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = values[i];
            }
            return result;
        }
        if (data instanceof byte[] values) {
            int[] result = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = values[i];
            }
            return result;
        }
        if (data instanceof Number number) {
            return new int[]{number.intValue()};
        }
        if (data instanceof float[] || data instanceof double[] || data instanceof String || data instanceof String[]) {
            double[] values = toDoubleArray(data, where);
            int[] result = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = (int) values[i];
            }
            return result;
        }
        if (data instanceof Object[] rows) {
            List<int[]> parts = new ArrayList<>(rows.length);
            int total = 0;
            for (Object row : rows) {
                int[] part = toIntArray(requireRow(row, where), where);
                parts.add(part);
                total += part.length;
            }
            int[] result = new int[total];
            int cursor = 0;
            for (int[] part : parts) {
                System.arraycopy(part, 0, result, cursor, part.length);
                cursor += part.length;
            }
            return result;
        }
        throw new IllegalStateException("数据不是整数数组：" + where);
    }

    static double[] toDoubleArray(Object data, String where) {
        if (data instanceof double[] values) {
            return values;
        }
        if (data instanceof float[] values) {
            double[] result = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = values[i];
            }
            return result;
        }
        if (data instanceof long[] values) {
            double[] result = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = values[i];
            }
            return result;
        }
        if (data instanceof int[] || data instanceof short[] || data instanceof byte[]) {
            int[] values = toIntArray(data, where);
            double[] result = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = values[i];
            }
            return result;
        }
        if (data instanceof Number number) {
            return new double[]{number.doubleValue()};
        }
        if (data instanceof String text) {
            return new double[]{parseDouble(text, where)};
        }
        if (data instanceof String[] texts) {
            double[] result = new double[texts.length];
            for (int i = 0; i < texts.length; i++) {
                result[i] = parseDouble(texts[i], where);
            }
            return result;
        }
        if (data instanceof Object[] rows) {
            List<double[]> parts = new ArrayList<>(rows.length);
            int total = 0;
            for (Object row : rows) {
                double[] part = toDoubleArray(requireRow(row, where), where);
                parts.add(part);
                total += part.length;
            }
            double[] result = new double[total];
            int cursor = 0;
            for (double[] part : parts) {
                System.arraycopy(part, 0, result, cursor, part.length);
                cursor += part.length;
            }
            return result;
        }
        throw new IllegalStateException("数据不是浮点数组：" + where);
    }

    /**
     * 二维视图：一维数据按 n×1 处理。
     */
    static double[][] toDoubleMatrix(Object data, String where) {
        if (data instanceof double[][] values) {
            return values;
        }
        if (isNested(data)) {
            Object[] rows = (Object[]) data;
            double[][] result = new double[rows.length][];
            for (int r = 0; r < rows.length; r++) {
                result[r] = toDoubleArray(requireRow(rows[r], where), where);
            }
            return result;
        }
        double[] column = toDoubleArray(data, where);
        double[][] result = new double[column.length][];
        for (int r = 0; r < column.length; r++) {
            result[r] = new double[]{column[r]};
        }
        return result;
    }

    static int[][] toIntMatrix(Object data, String where) {
        if (data instanceof int[][] values) {
            return values;
        }
        if (isNested(data)) {
            Object[] rows = (Object[]) data;
            int[][] result = new int[rows.length][];
            for (int r = 0; r < rows.length; r++) {
                result[r] = toIntArray(requireRow(rows[r], where), where);
            }
            return result;
        }
        int[] column = toIntArray(data, where);
        int[][] result = new int[column.length][];
        for (int r = 0; r < column.length; r++) {
            result[r] = new int[]{column[r]};
        }
        return result;
    }

    static String[] toStringArray(Object data, String where) {
        if (data instanceof String[] values) {
            return values;
        }
        if (data instanceof String text) {
            return new String[]{text};
        }
        if (data instanceof int[] || data instanceof long[] || data instanceof short[] || data instanceof byte[]) {
            int[] values = toIntArray(data, where);
            String[] result = new String[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = String.valueOf(values[i]);
            }
            return result;
        }
        if (data instanceof float[] || data instanceof double[]) {
            double[] values = toDoubleArray(data, where);
            String[] result = new String[values.length];
            for (int i = 0; i < values.length; i++) {
                result[i] = String.valueOf(values[i]);
            }
            return result;
        }
        if (data instanceof Object[] items) {
            List<String> result = new ArrayList<>(items.length);
            for (Object item : items) {
                if (item == null) {
                    result.add("");
                } else if (isArray(item)) {
                    result.addAll(List.of(toStringArray(item, where)));
                } else {
                    result.add(item.toString());
                }
            }
            return result.toArray(new String[0]);
        }
        throw new IllegalStateException("数据不是字符串：" + where);
    }

    /**
     * 单值字符串：多行数据按空格拼接。
     */
    static String toSingleString(Object data, String where) {
        if (data instanceof String text) {
            return text;
        }
        if (data instanceof Number number) {
            return number.toString();
        }
        return String.join(" ", toStringArray(data, where)).trim();
    }

    private static boolean isNested(Object data) {
        return data instanceof Object[] rows && rows.length > 0 && isArray(rows[0]);
    }

    private static boolean isArray(Object value) {
        return value instanceof Object[]
                || value instanceof double[]
                || value instanceof float[]
                || value instanceof long[]
                || value instanceof int[]
                || value instanceof short[]
                || value instanceof byte[];
    }

    private static Object requireRow(Object row, String where) {
        if (row == null) {
            throw new IllegalStateException("数据含空行：" + where);
        }
        return row;
    }

    private static double parseDouble(String text, String where) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("数据不是数值：" + where + " = " + text, e);
        }
    }
}
