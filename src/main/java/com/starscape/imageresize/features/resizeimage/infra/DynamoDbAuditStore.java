package com.starscape.imageresize.features.resizeimage.infra;

import com.starscape.imageresize.features.resizeimage.domain.AuditPersistenceException;
import com.starscape.imageresize.features.resizeimage.domain.AuditRecord;
import com.starscape.imageresize.features.resizeimage.domain.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Append-only audit table on DynamoDB, written through the Enhanced Client.
 * The put is conditional on the key being new, so an audit entry is never overwritten.
 */
@Repository
public class DynamoDbAuditStore implements AuditStore {
    
    private static final Logger log = LoggerFactory.getLogger(DynamoDbAuditStore.class);
    
    private static final Expression KEY_IS_NEW = Expression.builder()
            .expression("attribute_not_exists(#id)")
            .putExpressionName("#id", AuditItem.PARTITION_KEY)
            .build();
    
    private final DynamoDbTable<AuditItem> table;
    private final String tableName;
    
    public DynamoDbAuditStore(DynamoDbClient dynamoDb, @Value("${app.audit.table}") String tableName) {
        DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamoDb).build();
        this.table = enhanced.table(tableName, TableSchema.fromBean(AuditItem.class));
        this.tableName = tableName;
    }
    
    @Override
    public void put(AuditRecord record) {
        PutItemEnhancedRequest<AuditItem> request = PutItemEnhancedRequest.builder(AuditItem.class)
                .item(AuditItem.from(record))
                .conditionExpression(KEY_IS_NEW)
                .build();
        
        try {
            table.putItem(request);
            log.info("Audit record written: table={}, resourceId={}", tableName, record.resourceId());
        } catch (SdkException e) {
            throw new AuditPersistenceException(
                    "Failed to write audit record " + record.resourceId() + " to " + tableName + ": " + e.getMessage(), e);
        }
    }
}
