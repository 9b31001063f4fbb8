package tech.homeport.secrets.resource;

import java.util.Objects;
import java.util.Optional;

/**
 * Terraform-style resource type identifier, e.g. {@code aws_db_instance}.
 * The owning cloud provider is derived from the type prefix.
 */
public record ResourceType(String value) {

    // AWS
    public static final ResourceType AWS_RDS_INSTANCE = of("aws_db_instance");
    public static final ResourceType AWS_RDS_CLUSTER = of("aws_rds_cluster");
    public static final ResourceType AWS_ELASTICACHE_CLUSTER = of("aws_elasticache_cluster");
    public static final ResourceType AWS_ELASTICACHE_REPLICATION_GROUP = of("aws_elasticache_replication_group");
    public static final ResourceType AWS_LAMBDA_FUNCTION = of("aws_lambda_function");
    public static final ResourceType AWS_ECS_SERVICE = of("aws_ecs_service");
    public static final ResourceType AWS_ECS_TASK_DEFINITION = of("aws_ecs_task_definition");
    public static final ResourceType AWS_SECRETS_MANAGER_SECRET = of("aws_secretsmanager_secret");
    public static final ResourceType AWS_COGNITO_USER_POOL = of("aws_cognito_user_pool");

    // GCP
    public static final ResourceType GCP_CLOUD_SQL = of("google_sql_database_instance");
    public static final ResourceType GCP_MEMORYSTORE = of("google_redis_instance");
    public static final ResourceType GCP_CLOUD_RUN = of("google_cloud_run_service");
    public static final ResourceType GCP_CLOUD_FUNCTION = of("google_cloudfunctions_function");
    public static final ResourceType GCP_SECRET_MANAGER = of("google_secret_manager_secret");

    // Azure
    public static final ResourceType AZURE_SQL = of("azurerm_mssql_server");
    public static final ResourceType AZURE_POSTGRES = of("azurerm_postgresql_flexible_server");
    public static final ResourceType AZURE_MYSQL = of("azurerm_mysql_flexible_server");
    public static final ResourceType AZURE_COSMOS_DB = of("azurerm_cosmosdb_account");
    public static final ResourceType AZURE_CACHE = of("azurerm_redis_cache");
    public static final ResourceType AZURE_APP_SERVICE = of("azurerm_linux_web_app");
    public static final ResourceType AZURE_FUNCTION = of("azurerm_linux_function_app");
    public static final ResourceType AZURE_CONTAINER_INSTANCE = of("azurerm_container_group");
    public static final ResourceType AZURE_KEY_VAULT = of("azurerm_key_vault");

    public ResourceType {
        Objects.requireNonNull(value, "value");
    }

    public static ResourceType of(String value) {
        return new ResourceType(value);
    }

    /**
     * Provider owning this type, or empty when the prefix is not recognised.
     */
    public Optional<CloudProvider> provider() {
        if (value.startsWith("aws_")) {
            return Optional.of(CloudProvider.AWS);
        }
        if (value.startsWith("google_")) {
            return Optional.of(CloudProvider.GCP);
        }
        if (value.startsWith("azurerm_")) {
            return Optional.of(CloudProvider.AZURE);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
