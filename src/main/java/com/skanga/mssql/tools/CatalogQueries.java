package com.skanga.mssql.tools;

/**
 * Catalog queries used by {@link MetadataService}. Column aliases are the keys of the returned maps.
 * Object lookups take (name, schema, schema) so that a null schema matches any schema.
 */
final class CatalogQueries {
    private CatalogQueries() {
    }

    static final String LIST_DATABASES = """
            SELECT name,
                   database_id,
                   create_date,
                   state_desc AS state,
                   recovery_model_desc AS recovery_model,
                   compatibility_level
            FROM sys.databases
            WHERE state_desc = 'ONLINE'
            ORDER BY name""";

    static final String LIST_PROCEDURES = """
            SELECT ROUTINE_SCHEMA, ROUTINE_NAME FROM INFORMATION_SCHEMA.ROUTINES
            WHERE ROUTINE_TYPE = 'PROCEDURE' ORDER BY ROUTINE_SCHEMA, ROUTINE_NAME""";

    static final String LIST_FUNCTIONS = """
            SELECT ROUTINE_SCHEMA, ROUTINE_NAME FROM INFORMATION_SCHEMA.ROUTINES
            WHERE ROUTINE_TYPE = 'FUNCTION' ORDER BY ROUTINE_SCHEMA, ROUTINE_NAME""";

    static final String LIST_VIEWS = """
            SELECT TABLE_SCHEMA, TABLE_NAME FROM INFORMATION_SCHEMA.VIEWS ORDER BY TABLE_SCHEMA, TABLE_NAME""";

    // Instance

    static final String INSTANCE_VERSION = """
            SELECT CAST(SERVERPROPERTY('MachineName') AS NVARCHAR(128)) AS machine_name,
                   CAST(SERVERPROPERTY('ServerName') AS NVARCHAR(128)) AS server_name,
                   ISNULL(CAST(SERVERPROPERTY('InstanceName') AS NVARCHAR(128)), 'Default') AS instance_name,
                   CAST(SERVERPROPERTY('ProductVersion') AS NVARCHAR(128)) AS product_version,
                   CAST(SERVERPROPERTY('ProductLevel') AS NVARCHAR(128)) AS product_level,
                   CAST(SERVERPROPERTY('Edition') AS NVARCHAR(128)) AS edition,
                   CAST(SERVERPROPERTY('EngineEdition') AS INT) AS engine_edition,
                   CAST(SERVERPROPERTY('Collation') AS NVARCHAR(128)) AS collation,
                   CAST(ISNULL(SERVERPROPERTY('IsIntegratedSecurityOnly'), 0) AS BIT) AS is_windows_auth_only,
                   CAST(ISNULL(SERVERPROPERTY('IsClustered'), 0) AS BIT) AS is_clustered,
                   CAST(ISNULL(SERVERPROPERTY('IsHadrEnabled'), 0) AS BIT) AS is_hadr_enabled,
                   CAST(ISNULL(SERVERPROPERTY('IsFullTextInstalled'), 0) AS BIT) AS is_fulltext_installed,
                   @@VERSION AS version_string""";

    static final String INSTANCE_CONFIGURATION = """
            SELECT (SELECT CAST(value_in_use AS INT) FROM sys.configurations WHERE name = 'max server memory (MB)') AS max_server_memory_mb,
                   (SELECT CAST(value_in_use AS INT) FROM sys.configurations WHERE name = 'min server memory (MB)') AS min_server_memory_mb,
                   (SELECT CAST(value_in_use AS INT) FROM sys.configurations WHERE name = 'max degree of parallelism') AS max_degree_of_parallelism,
                   (SELECT CAST(value_in_use AS INT) FROM sys.configurations WHERE name = 'cost threshold for parallelism') AS cost_threshold_for_parallelism""";

    static final String INSTANCE_RESOURCES = """
            SELECT cpu_count AS logical_cpu_count,
                   hyperthread_ratio,
                   physical_memory_kb / 1024 AS physical_memory_mb,
                   virtual_memory_kb / 1024 AS virtual_memory_mb,
                   committed_kb / 1024 AS committed_memory_mb,
                   committed_target_kb / 1024 AS committed_target_mb
            FROM sys.dm_os_sys_info""";

    static final String INSTANCE_DATABASE_SUMMARY = """
            SELECT COUNT(*) AS total_databases,
                   SUM(CASE WHEN state_desc = 'ONLINE' THEN 1 ELSE 0 END) AS online_databases,
                   SUM(CASE WHEN name NOT IN ('master', 'tempdb', 'model', 'msdb') THEN 1 ELSE 0 END) AS user_databases
            FROM sys.databases""";

    // Database

    static final String DATABASE_INFO = """
            SELECT db.name,
                   db.database_id,
                   db.create_date,
                   db.compatibility_level,
                   db.collation_name AS collation,
                   db.user_access_desc AS user_access,
                   db.is_read_only,
                   db.is_auto_close_on,
                   db.is_auto_shrink_on,
                   db.state_desc AS state,
                   db.recovery_model_desc AS recovery_model,
                   SUSER_SNAME(db.owner_sid) AS owner
            FROM sys.databases db
            WHERE db.name = DB_NAME()""";

    static final String DATABASE_ENCRYPTION = """
            SELECT CASE
                       WHEN EXISTS (SELECT 1 FROM sys.columns WHERE object_id = OBJECT_ID('sys.databases') AND name = 'is_encrypted')
                       THEN (SELECT CAST(is_encrypted AS INT) FROM sys.databases WHERE database_id = DB_ID())
                       ELSE 0
                   END AS is_encrypted""";

    static final String DATABASE_CHANGE_TRACKING = """
            SELECT CASE
                       WHEN EXISTS (SELECT 1 FROM sys.columns WHERE object_id = OBJECT_ID('sys.databases') AND name = 'is_change_tracking_enabled')
                       THEN (SELECT CAST(is_change_tracking_enabled AS INT) FROM sys.databases WHERE database_id = DB_ID())
                       ELSE 0
                   END AS is_change_tracking_enabled""";

    static final String DATABASE_SIZE = """
            SELECT SUM(CAST(size AS BIGINT) * 8 / 1024) AS total_mb,
                   SUM(CASE WHEN type = 0 THEN CAST(size AS BIGINT) * 8 / 1024 ELSE 0 END) AS data_mb,
                   SUM(CASE WHEN type = 1 THEN CAST(size AS BIGINT) * 8 / 1024 ELSE 0 END) AS log_mb
            FROM sys.master_files
            WHERE database_id = DB_ID()""";

    static final String DATABASE_FILES = """
            SELECT name AS file_name,
                   physical_name,
                   type_desc AS file_type,
                   CAST(size AS BIGINT) * 8 / 1024 AS size_mb,
                   CASE
                       WHEN max_size = -1 THEN 'Unlimited'
                       WHEN max_size = 0 THEN 'No Growth'
                       ELSE CAST(CAST(max_size AS BIGINT) * 8 / 1024 AS VARCHAR) + ' MB'
                   END AS max_size,
                   CASE
                       WHEN is_percent_growth = 1 THEN CAST(growth AS VARCHAR) + '%'
                       ELSE CAST(CAST(growth AS BIGINT) * 8 / 1024 AS VARCHAR) + ' MB'
                   END AS growth_setting,
                   state_desc AS state
            FROM sys.database_files
            ORDER BY type, file_id""";

    static final String DATABASE_OBJECT_COUNTS = """
            SELECT (SELECT COUNT(*) FROM sys.tables WHERE is_ms_shipped = 0) AS tables,
                   (SELECT COUNT(*) FROM sys.views WHERE is_ms_shipped = 0) AS views,
                   (SELECT COUNT(*) FROM sys.procedures WHERE is_ms_shipped = 0) AS stored_procedures,
                   (SELECT COUNT(*) FROM sys.objects WHERE type IN ('FN', 'IF', 'TF') AND is_ms_shipped = 0) AS functions,
                   (SELECT COUNT(*) FROM sys.triggers WHERE is_ms_shipped = 0) AS triggers,
                   (SELECT COUNT(DISTINCT name) FROM sys.schemas WHERE schema_id > 4) AS user_schemas""";

    static final String DATABASE_SCHEMAS = """
            SELECT s.name, USER_NAME(s.principal_id) AS owner, s.schema_id
            FROM sys.schemas s
            WHERE s.schema_id > 4
            ORDER BY s.name""";

    // Shared object lookups

    private static final String PROCEDURE_ID = """
            (SELECT p.object_id FROM sys.procedures p INNER JOIN sys.schemas s ON p.schema_id = s.schema_id
             WHERE p.name = ? AND (s.name = ? OR ? IS NULL))""";

    private static final String FUNCTION_ID = """
            (SELECT o.object_id FROM sys.objects o INNER JOIN sys.schemas s ON o.schema_id = s.schema_id
             WHERE o.type IN ('FN', 'IF', 'TF') AND o.name = ? AND (s.name = ? OR ? IS NULL))""";

    private static final String TABLE_FUNCTION_ID = """
            (SELECT o.object_id FROM sys.objects o INNER JOIN sys.schemas s ON o.schema_id = s.schema_id
             WHERE o.type IN ('IF', 'TF') AND o.name = ? AND (s.name = ? OR ? IS NULL))""";

    private static final String VIEW_ID = """
            (SELECT v.object_id FROM sys.views v INNER JOIN sys.schemas s ON v.schema_id = s.schema_id
             WHERE v.name = ? AND (s.name = ? OR ? IS NULL))""";

    private static final String DEFINITION_OF = "SELECT m.definition FROM sys.sql_modules m WHERE m.object_id = ";

    private static final String DEPENDENCIES_OF = """
            SELECT DISTINCT SCHEMA_NAME(o.schema_id) AS referenced_schema,
                   o.name AS referenced_object,
                   o.type_desc AS object_type
            FROM sys.sql_expression_dependencies d
            INNER JOIN sys.objects o ON d.referenced_id = o.object_id
            WHERE d.referencing_id = """;

    // Stored procedure

    static final String PROCEDURE_INFO = """
            SELECT p.object_id AS id, p.name, s.name AS [schema], u.name AS owner, p.type,
                   p.create_date, p.modify_date, CAST(ep.value AS NVARCHAR(4000)) AS description
            FROM sys.procedures p
            INNER JOIN sys.schemas s ON p.schema_id = s.schema_id
            LEFT JOIN sys.extended_properties ep ON ep.major_id = p.object_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            LEFT JOIN sys.sysusers u ON p.principal_id = u.uid
            WHERE p.name = ? AND (s.name = ? OR ? IS NULL)""";

    static final String PROCEDURE_PARAMETERS = """
            SELECT param.name,
                   TYPE_NAME(param.user_type_id) AS type,
                   param.max_length AS length,
                   param.precision,
                   param.scale,
                   param.is_output,
                   param.has_default_value,
                   CAST(param.default_value AS NVARCHAR(4000)) AS default_value
            FROM sys.parameters param
            WHERE param.object_id = """ + PROCEDURE_ID + """

            ORDER BY param.parameter_id""";

    static final String PROCEDURE_DEFINITION = DEFINITION_OF + PROCEDURE_ID;

    static final String PROCEDURE_DEPENDENCIES = DEPENDENCIES_OF + PROCEDURE_ID;

    // Function

    static final String FUNCTION_INFO = """
            SELECT o.object_id AS id, o.name, s.name AS [schema], u.name AS owner, o.type,
                   o.type_desc AS type_description, o.create_date, o.modify_date,
                   CAST(ep.value AS NVARCHAR(4000)) AS description
            FROM sys.objects o
            INNER JOIN sys.schemas s ON o.schema_id = s.schema_id
            LEFT JOIN sys.extended_properties ep ON ep.major_id = o.object_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            LEFT JOIN sys.sysusers u ON o.principal_id = u.uid
            WHERE o.type IN ('FN', 'IF', 'TF') AND o.name = ? AND (s.name = ? OR ? IS NULL)""";

    static final String FUNCTION_PARAMETERS = """
            SELECT param.name,
                   TYPE_NAME(param.user_type_id) AS type,
                   param.max_length AS length,
                   param.precision,
                   param.scale,
                   param.has_default_value,
                   CAST(param.default_value AS NVARCHAR(4000)) AS default_value
            FROM sys.parameters param
            WHERE param.parameter_id > 0 AND param.object_id = """ + FUNCTION_ID + """

            ORDER BY param.parameter_id""";

    static final String FUNCTION_RETURN_TYPE = """
            SELECT TYPE_NAME(param.user_type_id) AS type,
                   param.max_length AS length,
                   param.precision,
                   param.scale
            FROM sys.parameters param
            WHERE param.parameter_id = 0 AND param.object_id = """ + FUNCTION_ID;

    static final String FUNCTION_TABLE_COLUMNS = """
            SELECT c.name,
                   TYPE_NAME(c.user_type_id) AS type,
                   c.max_length AS length,
                   c.precision,
                   c.scale,
                   c.is_nullable AS nullable
            FROM sys.columns c
            WHERE c.object_id = """ + TABLE_FUNCTION_ID + """

            ORDER BY c.column_id""";

    static final String FUNCTION_DEFINITION = DEFINITION_OF + FUNCTION_ID;

    static final String FUNCTION_DEPENDENCIES = DEPENDENCIES_OF + FUNCTION_ID;

    // View

    static final String VIEW_INFO = """
            SELECT v.object_id AS id, v.name, s.name AS [schema], u.name AS owner, v.type,
                   CAST(p.value AS NVARCHAR(4000)) AS description
            FROM sys.views v
            INNER JOIN sys.schemas s ON v.schema_id = s.schema_id
            LEFT JOIN sys.extended_properties p ON p.major_id = v.object_id AND p.minor_id = 0 AND p.name = 'MS_Description'
            LEFT JOIN sys.sysusers u ON v.principal_id = u.uid
            WHERE v.name = ? AND (s.name = ? OR ? IS NULL)""";

    static final String VIEW_COLUMNS = """
            SELECT c.name, ty.name AS type, c.max_length AS length, c.precision, c.scale,
                   c.is_nullable AS nullable, CAST(p.value AS NVARCHAR(4000)) AS description
            FROM sys.columns c
            INNER JOIN sys.types ty ON c.user_type_id = ty.user_type_id
            LEFT JOIN sys.extended_properties p ON p.major_id = c.object_id AND p.minor_id = c.column_id AND p.name = 'MS_Description'
            WHERE c.object_id = """ + VIEW_ID + """

            ORDER BY c.column_id""";

    static final String VIEW_INDEXES = """
            SELECT i.name, i.type_desc AS type, CAST(p.value AS NVARCHAR(4000)) AS description,
                   STUFF((SELECT ',' + c.name FROM sys.index_columns ic
                          INNER JOIN sys.columns c ON ic.object_id = c.object_id AND ic.column_id = c.column_id
                          WHERE ic.object_id = i.object_id AND ic.index_id = i.index_id
                          ORDER BY ic.key_ordinal FOR XML PATH('')), 1, 1, '') AS keys
            FROM sys.indexes i
            LEFT JOIN sys.extended_properties p ON p.major_id = i.object_id AND p.minor_id = i.index_id AND p.name = 'MS_Description'
            WHERE i.object_id = """ + VIEW_ID;

    static final String VIEW_DEFINITION = DEFINITION_OF + VIEW_ID;

    static final String VIEW_DEPENDENCIES = DEPENDENCIES_OF + VIEW_ID;
}
