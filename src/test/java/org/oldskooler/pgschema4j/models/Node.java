package org.oldskooler.pgschema4j.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.oldskooler.pgschema4j.annotations.Pg;

import java.time.LocalDateTime;
import java.util.UUID;

/** A self referencing row, copied into a child by the duplicate query. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Node {
    @Pg("type=uuid,primary")
    private UUID id;
    @Pg("type=timestamp,default=clock_timestamp()")
    private LocalDateTime createdAt;
    @Pg("type=uuid,ref=test(id),nullable")
    private UUID sourceId;
    @Pg("type=varchar(255)")
    private String name;
}
