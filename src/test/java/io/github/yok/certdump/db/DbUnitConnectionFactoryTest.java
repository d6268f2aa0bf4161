package io.github.yok.certdump.db;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConnectionFactoryTest {

    @Test
    void configure_正常ケース_データ型ファクトリとエスケープ設定が適用されること() {
        DatabaseConfig cfg = mock(DatabaseConfig.class);
        IDataTypeFactory factory = mock(IDataTypeFactory.class);

        new DbUnitConnectionFactory().configure(cfg, factory);

        verify(cfg).setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, factory);
        verify(cfg).setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, "\"?\"");
        verify(cfg).setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, true);
    }
}
