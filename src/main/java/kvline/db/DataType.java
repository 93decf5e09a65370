package kvline.db;

public enum DataType {
    STRING,
    LIST,
    SET
}
