package com.bastion.security.authz;

import java.util.List;

/**
 * Protected operations and the permissions each requires.
 */
public enum Operation {

    // bucket objects
    BUCKET_OBJECTS_LIST("bucket_objects_list", true, "s3:ListBucket", "s3:GetBucketLocation"),
    BUCKET_OBJECT_INFO("bucket_object_info", true, "s3:GetObject", "s3:GetObjectVersion"),
    BUCKET_OBJECT_TEXT("bucket_object_text", true, "s3:GetObject"),
    BUCKET_OBJECT_FETCH("bucket_object_fetch", true, "s3:GetObject", "s3:GetObjectVersion"),
    BUCKET_OBJECTS_PUT("bucket_objects_put", true, "s3:PutObject", "s3:PutObjectAcl"),
    BUCKET_OBJECT_LINK("bucket_object_link", true, "s3:GetObject"),

    // packages
    PACKAGE_CREATE("package_create", true,
            "s3:PutObject", "s3:PutObjectAcl", "s3:ListBucket", "s3:GetObject"),
    PACKAGE_UPDATE("package_update", true,
            "s3:GetObject", "s3:PutObject", "s3:ListBucket", "s3:DeleteObject"),
    PACKAGE_DELETE("package_delete", true, "s3:DeleteObject", "s3:ListBucket"),
    PACKAGE_BROWSE("package_browse", true, "s3:ListBucket", "s3:GetObject"),
    PACKAGE_CONTENTS_SEARCH("package_contents_search", true, "s3:ListBucket"),
    PACKAGE_DIFF("package_diff", true, "s3:ListBucket", "s3:GetObject"),
    PACKAGE_CREATE_FROM_S3("package_create_from_s3", true,
            "s3:ListBucket", "s3:GetObject", "s3:PutObject", "s3:PutObjectAcl"),
    CREATE_PACKAGE_ENHANCED("create_package_enhanced", true,
            "s3:PutObject", "s3:PutObjectAcl", "s3:ListBucket", "s3:GetObject"),
    CREATE_PACKAGE_FROM_S3("create_package_from_s3", true,
            "s3:ListBucket", "s3:GetObject", "s3:PutObject", "s3:PutObjectAcl"),

    // query engine and catalog
    ATHENA_QUERY_EXECUTE("athena_query_execute", false,
            "athena:StartQueryExecution", "athena:GetQueryExecution",
            "athena:GetQueryResults", "athena:StopQueryExecution"),
    ATHENA_DATABASES_LIST("athena_databases_list", false, "glue:GetDatabases"),
    ATHENA_TABLES_LIST("athena_tables_list", false, "glue:GetTables", "glue:GetDatabase"),
    ATHENA_TABLE_SCHEMA("athena_table_schema", false, "glue:GetTable", "glue:GetDatabase"),
    ATHENA_WORKGROUPS_LIST("athena_workgroups_list", false, "athena:ListWorkGroups"),
    ATHENA_QUERY_HISTORY("athena_query_history", false,
            "athena:ListQueryExecutions", "athena:BatchGetQueryExecution"),

    // tabulator
    TABULATOR_TABLES_LIST("tabulator_tables_list", false, "glue:GetDatabases", "glue:GetTables"),
    TABULATOR_TABLE_CREATE("tabulator_table_create", false, "glue:CreateTable", "glue:GetTable", "s3:ListBucket"),

    // search
    UNIFIED_SEARCH("unified_search", false, "s3:ListBucket", "glue:GetTables", "glue:GetDatabases"),
    PACKAGES_SEARCH("packages_search", false, "s3:ListBucket"),

    // permission discovery
    AWS_PERMISSIONS_DISCOVER("aws_permissions_discover", false,
            "iam:ListAttachedUserPolicies", "iam:ListUserPolicies", "iam:GetPolicy", "iam:GetPolicyVersion"),
    BUCKET_ACCESS_CHECK("bucket_access_check", true, "s3:ListBucket", "s3:GetBucketLocation"),
    BUCKET_RECOMMENDATIONS_GET("bucket_recommendations_get", false, "s3:ListAllMyBuckets");

    private final String operationName;
    private final boolean bucketScoped;
    private final List<String> permissions;

    Operation(String operationName, boolean bucketScoped, String... permissions) {
        this.operationName = operationName;
        this.bucketScoped = bucketScoped;
        this.permissions = List.of(permissions);
    }

    public String operationName() {
        return operationName;
    }

    public boolean bucketScoped() {
        return bucketScoped;
    }

    public List<String> permissions() {
        return permissions;
    }

    public PermissionRequirement requirement() {
        return new PermissionRequirement(operationName, permissions, bucketScoped);
    }
}
