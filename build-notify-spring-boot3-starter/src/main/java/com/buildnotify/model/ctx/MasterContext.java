package com.buildnotify.model.ctx;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * master 共享信息, 传给上下文组装和扩展钩子
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MasterContext {

    /** 站点标题, 无 project 时作为项目名 */
    private String title;

    /** 对外访问地址, 以 / 结尾 */
    private String buildbotUrl;
}
