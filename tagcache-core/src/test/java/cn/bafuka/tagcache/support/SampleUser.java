package cn.bafuka.tagcache.support;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 测试用实体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SampleUser {

    private Long id;

    private String name;
}
